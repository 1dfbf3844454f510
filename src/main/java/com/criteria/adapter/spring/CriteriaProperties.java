package com.criteria.adapter.spring;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Spring Boot configuration properties for criteria.
 */
@ConfigurationProperties(prefix = "criteria")
public class CriteriaProperties {

    /**
     * Whether the criteria beans are registered.
     */
    private boolean enabled = true;

    /**
     * Logical field name to physical column name, applied by the SQL compiler and the
     * descriptor converter.
     */
    private Map<String, String> columnMapping = new LinkedHashMap<>();

    /**
     * Columns selected when a compile call names none.
     */
    private List<String> defaultColumns = new ArrayList<>(List.of("*"));

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public Map<String, String> getColumnMapping() {
        return columnMapping;
    }

    public void setColumnMapping(Map<String, String> columnMapping) {
        this.columnMapping = columnMapping;
    }

    public List<String> getDefaultColumns() {
        return defaultColumns;
    }

    public void setDefaultColumns(List<String> defaultColumns) {
        this.defaultColumns = defaultColumns;
    }
}
