package com.blockstore.model.properties;

import java.util.Map;

public class DatasetProperties extends BlockProperties {

    public DatasetProperties(Map<String, Object> values) {
        super(values);
        stringValue("dataset_type");
    }

    public String datasetType() {
        return stringValue("dataset_type");
    }
}
