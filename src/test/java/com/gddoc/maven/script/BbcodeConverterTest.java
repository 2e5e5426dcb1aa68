package com.gddoc.maven.script;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class BbcodeConverterTest {

    @Test
    void toMarkdown_simpleTags() {
        assertThat(BbcodeConverter.toMarkdown("[b]bold[/b] [i]it[/i] [s]gone[/s] [code]x()[/code]"))
                .isEqualTo("**bold** _it_ ~~gone~~ `x()`");
        assertThat(BbcodeConverter.toMarkdown("a[br]b")).isEqualTo("a\nb");
        assertThat(BbcodeConverter.toMarkdown("[codeblock]var a = 1[/codeblock]")).isEqualTo("```var a = 1```");
    }

    @Test
    void toMarkdown_linksAndImages() {
        assertThat(BbcodeConverter.toMarkdown("See [url=https://godotengine.org]Godot[/url] and [url=a]b[/url]."))
                .isEqualTo("See [Godot](https://godotengine.org) and [b](a).");
        assertThat(BbcodeConverter.toMarkdown("[img width=32]res://icon.svg[/img]")).isEqualTo("![](res://icon.svg)");
        assertThat(BbcodeConverter.toMarkdown("[url]https://example.org[/url]")).isEqualTo("https://example.org");
    }

    @Test
    void toMarkdown_nullAndEmpty() {
        assertThat(BbcodeConverter.toMarkdown(null)).isNull();
        assertThat(BbcodeConverter.toMarkdown("")).isEmpty();
        assertThat(BbcodeConverter.toMarkdown("plain [unknown] text")).isEqualTo("plain [unknown] text");
    }
}
