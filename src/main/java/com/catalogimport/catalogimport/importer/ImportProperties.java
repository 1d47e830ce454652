package com.catalogimport.catalogimport.importer;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Externalized import configuration bound from {@code application.properties}.
 */
@ConfigurationProperties(prefix = "catalog.import")
public class ImportProperties {

    private String varDirectory = ImportConstants.DEFAULT_VAR_DIRECTORY;
    private String adminStoreCode = ImportConstants.DEFAULT_ADMIN_STORE_CODE;
    private String defaultAttributeSetName = ImportConstants.DEFAULT_ATTRIBUTE_SET_NAME;
    private String multiselectBackendModel = ImportConstants.DEFAULT_MULTISELECT_BACKEND_MODEL;
    private int optionSortStep = ImportConstants.DEFAULT_OPTION_SORT_STEP;

    public String getVarDirectory() {
        return varDirectory;
    }

    public void setVarDirectory(String varDirectory) {
        this.varDirectory = varDirectory;
    }

    public String getAdminStoreCode() {
        return adminStoreCode;
    }

    public void setAdminStoreCode(String adminStoreCode) {
        this.adminStoreCode = adminStoreCode;
    }

    public String getDefaultAttributeSetName() {
        return defaultAttributeSetName;
    }

    public void setDefaultAttributeSetName(String defaultAttributeSetName) {
        this.defaultAttributeSetName = defaultAttributeSetName;
    }

    public String getMultiselectBackendModel() {
        return multiselectBackendModel;
    }

    public void setMultiselectBackendModel(String multiselectBackendModel) {
        this.multiselectBackendModel = multiselectBackendModel;
    }

    public int getOptionSortStep() {
        return optionSortStep;
    }

    public void setOptionSortStep(int optionSortStep) {
        this.optionSortStep = optionSortStep;
    }
}
