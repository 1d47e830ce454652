package com.catalogimport.catalogimport.cli;

import com.catalogimport.catalogimport.csv.CsvValidationException;
import com.catalogimport.catalogimport.importer.CatalogImportService;
import com.catalogimport.catalogimport.importer.ImportConstants;
import com.catalogimport.catalogimport.importer.ImportSummary;
import com.catalogimport.catalogimport.importer.ImportValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.concurrent.Callable;

@Component
@Command(
        name = "catalog:product:attributes:import",
        mixinStandardHelpOptions = true,
        description = "Imports product attributes or deletes attribute sets from a CSV file."
)
public class ProductAttributesImportCommand implements Callable<Integer> {

    static final int EXIT_SUCCESS = 0;
    static final int EXIT_FAILURE = 1;

    private static final Logger log = LoggerFactory.getLogger(ProductAttributesImportCommand.class);

    private final CatalogImportService catalogImportService;

    @Parameters(index = "0", paramLabel = "CSV", description = "CSV file, relative to the var directory.")
    private String csv;

    @Option(names = {"-t", "--type"}, defaultValue = ImportConstants.TYPE_ATTRIBUTE,
            description = "Import type: attribute or attribute-set (default: ${DEFAULT-VALUE}).")
    private String type;

    @Option(names = {"-b", "--behavior"}, defaultValue = "add",
            description = "Import behavior: add, update or delete (default: ${DEFAULT-VALUE}).")
    private String behavior;

    @Option(names = {"-v", "--verbose"}, defaultValue = "false", description = "Show diagnostic messages.")
    private boolean verbose;

    public ProductAttributesImportCommand(CatalogImportService catalogImportService) {
        this.catalogImportService = catalogImportService;
    }

    @Override
    public Integer call() {
        try {
            ImportSummary summary = catalogImportService.run(csv, type, behavior, verbose);
            return summary.successful() ? EXIT_SUCCESS : EXIT_FAILURE;
        } catch (ImportValidationException | CsvValidationException ex) {
            log.error(ex.getMessage());
            return EXIT_FAILURE;
        }
    }
}
