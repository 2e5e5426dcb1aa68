package com.gddoc.maven.config;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import com.gddoc.template.TemplateOptions;

/**
 * Settings read from {@code gddoc.yaml}.
 */
public class DocsConfig {
    private List<String> exclude;
    private boolean namedOnly;
    private boolean trimBlocks = true;
    private boolean lstripBlocks = true;
    private String fileExtension = ".md";

    public DocsConfig() {
        this.exclude = new ArrayList<>();
    }

    public List<String> getExclude() {
        return exclude;
    }

    public void setExclude(List<String> exclude) {
        this.exclude = exclude;
    }

    public boolean isNamedOnly() {
        return namedOnly;
    }

    public void setNamedOnly(boolean namedOnly) {
        this.namedOnly = namedOnly;
    }

    public boolean isTrimBlocks() {
        return trimBlocks;
    }

    public void setTrimBlocks(boolean trimBlocks) {
        this.trimBlocks = trimBlocks;
    }

    public boolean isLstripBlocks() {
        return lstripBlocks;
    }

    public void setLstripBlocks(boolean lstripBlocks) {
        this.lstripBlocks = lstripBlocks;
    }

    public String getFileExtension() {
        return fileExtension;
    }

    public void setFileExtension(String fileExtension) {
        this.fileExtension = fileExtension;
    }

    public TemplateOptions toTemplateOptions() {
        return new TemplateOptions(trimBlocks, lstripBlocks);
    }

    public static DocsConfig fromMap(Map<String, Object> map) {
        DocsConfig config = new DocsConfig();
        if (map == null) {
            return config;
        }

        Object exclude = map.get("exclude");
        if (exclude instanceof List) {
            for (Object entry : (List<?>) exclude) {
                if (entry != null) {
                    config.getExclude().add(entry.toString());
                }
            }
        } else if (exclude instanceof String) {
            config.getExclude().add((String) exclude);
        }

        config.setNamedOnly(bool(map.get("namedOnly"), false));
        config.setTrimBlocks(bool(map.get("trimBlocks"), true));
        config.setLstripBlocks(bool(map.get("lstripBlocks"), true));

        Object extension = map.get("fileExtension");
        if (extension != null) {
            String text = extension.toString();
            config.setFileExtension(text.isEmpty() || text.startsWith(".") ? text : "." + text);
        }
        return config;
    }

    private static boolean bool(Object value, boolean fallback) {
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        if (value instanceof String) {
            return Boolean.parseBoolean((String) value);
        }
        return fallback;
    }
}
