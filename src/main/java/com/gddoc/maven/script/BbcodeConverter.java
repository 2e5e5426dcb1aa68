package com.gddoc.maven.script;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Converts the BBCode subset used in GDScript doc comments to Markdown.
 */
public final class BbcodeConverter {

    private static final Pattern IMAGE = Pattern.compile("\\[img[^\\]]*\\](.*?)\\[/img\\]");
    private static final Pattern LINK = Pattern.compile("\\[url=([^\\]]*)\\](.*?)\\[/url\\]");

    // Replaced for both the opening and the closing form.
    private static final Map<String, String> SIMPLE_TAGS = new LinkedHashMap<>();

    static {
        SIMPLE_TAGS.put("b", "**");
        SIMPLE_TAGS.put("i", "_");
        SIMPLE_TAGS.put("s", "~~");
        SIMPLE_TAGS.put("code", "`");
        SIMPLE_TAGS.put("codeblock", "```");
        SIMPLE_TAGS.put("br", "\n");
    }

    public static String toMarkdown(String text) {
        if (text == null || text.isEmpty()) {
            return text;
        }
        // Links are built last so their output is never rescanned for tags.
        String result = text;
        for (Map.Entry<String, String> tag : SIMPLE_TAGS.entrySet()) {
            result = result.replace("[" + tag.getKey() + "]", tag.getValue())
                    .replace("[/" + tag.getKey() + "]", tag.getValue());
        }
        result = IMAGE.matcher(result).replaceAll("![]($1)");
        result = LINK.matcher(result).replaceAll("[$2]($1)");
        return result.replace("[url]", "").replace("[/url]", "");
    }

    private BbcodeConverter() {
    }
}
