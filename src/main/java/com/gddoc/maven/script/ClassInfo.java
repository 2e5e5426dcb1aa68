package com.gddoc.maven.script;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Everything documented about one GDScript file.
 */
public class ClassInfo {
    private final String filePath;
    private String name;
    private String extendsName = "";
    private String summary;
    private String description;
    private final List<SignalInfo> signals = new ArrayList<>();
    private final List<EnumInfo> enums = new ArrayList<>();
    private final List<PropertyInfo> properties = new ArrayList<>();
    private final List<MethodInfo> methods = new ArrayList<>();

    public ClassInfo(String filePath) {
        this.filePath = filePath;
    }

    /**
     * @return path relative to the project, with {@code /} separators
     */
    public String getFilePath() {
        return filePath;
    }

    /**
     * @return the {@code class_name}, or null for an unnamed script
     */
    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    /**
     * @return the {@code extends} target as written, empty when absent
     */
    public String getExtendsName() {
        return extendsName;
    }

    public void setExtendsName(String extendsName) {
        this.extendsName = extendsName == null ? "" : extendsName;
    }

    public String getSummary() {
        return summary;
    }

    public void setSummary(String summary) {
        this.summary = summary;
    }

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description;
    }

    public List<SignalInfo> getSignals() {
        return signals;
    }

    public List<EnumInfo> getEnums() {
        return enums;
    }

    public List<PropertyInfo> getProperties() {
        return properties;
    }

    public List<MethodInfo> getMethods() {
        return methods;
    }

    /**
     * Key under which the class is documented: its {@code class_name}, or the relative path
     * with separators replaced by {@code -}.
     */
    public String getKey() {
        return name != null ? name : filePath.replace('/', '-');
    }

    /**
     * Builds the template context for this class.
     */
    public Map<String, Object> toContext() {
        Map<String, Object> context = new LinkedHashMap<>();
        context.put("name", name);
        context.put("file_path", filePath);
        context.put("extends", extendsName);
        context.put("summary", summary);
        context.put("description", description);

        List<Map<String, Object>> signalList = new ArrayList<>();
        signals.forEach(s -> signalList.add(s.toContext()));
        context.put("signals", signalList);

        List<Map<String, Object>> enumList = new ArrayList<>();
        enums.forEach(e -> enumList.add(e.toContext()));
        context.put("enums", enumList);

        List<Map<String, Object>> propertyList = new ArrayList<>();
        properties.forEach(p -> propertyList.add(p.toContext()));
        context.put("properties", propertyList);

        List<Map<String, Object>> methodList = new ArrayList<>();
        methods.forEach(m -> methodList.add(m.toContext()));
        context.put("methods", methodList);
        return context;
    }
}
