package com.catalogimport.catalogimport.importer;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import com.catalogimport.catalogimport.attribute.AttributeReconciler;
import com.catalogimport.catalogimport.attribute.AttributeRow;
import com.catalogimport.catalogimport.attributeset.AttributeSetReconciler;
import com.catalogimport.catalogimport.catalog.StoreDirectory;
import com.catalogimport.catalogimport.csv.CsvTableReader;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

class CatalogImportServiceRowErrorTest {

    @TempDir
    Path varDirectory;

    @Test
    void shouldCountUnexpectedRowFailureAndContinueWithNextRow() throws IOException {
        Files.writeString(
                varDirectory.resolve("two_rows.csv"),
                "attribute_code,label\ncolor,Color\nsize,Size\n",
                StandardCharsets.UTF_8
        );
        ImportProperties properties = new ImportProperties();
        properties.setVarDirectory(varDirectory.toString());
        AttributeReconciler attributeReconciler = mock(AttributeReconciler.class);
        doThrow(new IllegalStateException("connection reset"))
                .doNothing()
                .when(attributeReconciler).process(any(AttributeRow.class), eq(ImportBehavior.ADD), any(ImportContext.class));
        CatalogImportService service = new CatalogImportService(
                new CsvTableReader(properties),
                attributeReconciler,
                mock(AttributeSetReconciler.class),
                mock(StoreDirectory.class),
                properties
        );

        Logger serviceLogger = (Logger) LoggerFactory.getLogger(CatalogImportService.class);
        ListAppender<ILoggingEvent> appender = new ListAppender<>();
        appender.start();
        serviceLogger.addAppender(appender);

        ImportSummary summary;
        try {
            summary = service.run("two_rows.csv", "attribute", "add", false);
        } finally {
            serviceLogger.detachAppender(appender);
        }

        ArgumentCaptor<AttributeRow> rows = ArgumentCaptor.forClass(AttributeRow.class);
        verify(attributeReconciler, times(2)).process(rows.capture(), eq(ImportBehavior.ADD), any(ImportContext.class));
        assertEquals("size", rows.getAllValues().get(1).code());
        assertEquals(1, summary.errors());
        assertFalse(summary.successful());
        assertTrue(appender.list.stream().anyMatch(event -> event.getLevel() == Level.ERROR
                && event.getFormattedMessage().equals("1 error(s) occurred during import")));
    }
}
