package de.seuhd.balizas.data.datex2;

import org.junit.jupiter.api.Test;
import org.w3c.dom.Element;

import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class Datex2ElementsTest {
    private static final String NS_A = "urn:a";
    private static final String NS_B = "urn:b";

    private final Datex2DocumentLoader loader = new Datex2DocumentLoader();

    private Element root(String xml) {
        return loader.parse(xml.getBytes(StandardCharsets.UTF_8)).getDocumentElement();
    }

    @Test
    void findFirstReturnsFirstMatchInDocumentOrder() {
        Element root = root("""
                <a:root xmlns:a="urn:a">
                  <a:wrapper><a:item>nested</a:item></a:wrapper>
                  <a:item>direct</a:item>
                </a:root>
                """);

        assertThat(Datex2Elements.text(Datex2Elements.findFirst(root, NS_A, "item"))).isEqualTo("nested");
    }

    @Test
    void findFirstMatchesByNamespaceUriNotPrefix() {
        Element root = root("""
                <x:root xmlns:x="urn:a" xmlns:y="urn:b" xmlns:z="urn:a">
                  <y:item>other namespace</y:item>
                  <z:item>same namespace, other prefix</z:item>
                </x:root>
                """);

        assertThat(Datex2Elements.text(Datex2Elements.findFirst(root, NS_A, "item")))
                .isEqualTo("same namespace, other prefix");
        assertThat(Datex2Elements.text(Datex2Elements.findFirst(root, NS_B, "item")))
                .isEqualTo("other namespace");
    }

    @Test
    void findFirstDoesNotMatchScopeItself() {
        Element root = root("<a:item xmlns:a=\"urn:a\"><a:other/></a:item>");

        assertThat(Datex2Elements.findFirst(root, NS_A, "item")).isNull();
    }

    @Test
    void findAllIncludesNestedMatchesInDocumentOrder() {
        Element root = root("""
                <a:root xmlns:a="urn:a">
                  <a:item id="1"><a:item id="2"/></a:item>
                  <a:item id="3"/>
                </a:root>
                """);

        List<Element> items = Datex2Elements.findAll(root, NS_A, "item");

        assertThat(items).extracting(item -> item.getAttribute("id")).containsExactly("1", "2", "3");
    }

    @Test
    void findChildIgnoresDeeperDescendants() {
        Element root = root("""
                <a:root xmlns:a="urn:a">
                  <a:wrapper><a:item/></a:wrapper>
                </a:root>
                """);

        assertThat(Datex2Elements.findChild(root, NS_A, "item")).isNull();
        assertThat(Datex2Elements.findChild(root, NS_A, "wrapper")).isNotNull();
    }

    @Test
    void textIsAbsentForMissingOrEmptyElements() {
        Element root = root("<a:root xmlns:a=\"urn:a\"><a:empty/><a:blank>  </a:blank></a:root>");

        assertThat(Datex2Elements.text(null)).isNull();
        assertThat(Datex2Elements.text(Datex2Elements.findChild(root, NS_A, "empty"))).isNull();
        assertThat(Datex2Elements.text(Datex2Elements.findChild(root, NS_A, "blank"))).isNull();
    }

    @Test
    void textReadsCdataAndTrims() {
        Element root = root("<a:root xmlns:a=\"urn:a\"><a:value>\n  <![CDATA[A-1]]>\n</a:value></a:root>");

        assertThat(Datex2Elements.text(Datex2Elements.findChild(root, NS_A, "value"))).isEqualTo("A-1");
    }

    @Test
    void parseDoubleTreatsInvalidInputAsAbsent() {
        assertThat(Datex2Elements.parseDouble("40.25")).isEqualTo(40.25);
        assertThat(Datex2Elements.parseDouble("-3.5")).isEqualTo(-3.5);
        assertThat(Datex2Elements.parseDouble(null)).isNull();
        assertThat(Datex2Elements.parseDouble("")).isNull();
        assertThat(Datex2Elements.parseDouble("12,5")).isNull();
        assertThat(Datex2Elements.parseDouble("km 12")).isNull();
        assertThat(Datex2Elements.parseDouble("40.5f")).isNull();
        assertThat(Datex2Elements.parseDouble("-3.5d")).isNull();
        assertThat(Datex2Elements.parseDouble("0x1p4")).isNull();
        assertThat(Datex2Elements.parseDouble("NaN")).isNull();
        assertThat(Datex2Elements.parseDouble("Infinity")).isNull();
    }

    @Test
    void parseDoubleAcceptsPlainDecimalForms() {
        assertThat(Datex2Elements.parseDouble("+12")).isEqualTo(12.0);
        assertThat(Datex2Elements.parseDouble("12.")).isEqualTo(12.0);
        assertThat(Datex2Elements.parseDouble(".5")).isEqualTo(0.5);
        assertThat(Datex2Elements.parseDouble("1.25e2")).isEqualTo(125.0);
        assertThat(Datex2Elements.parseDouble("-4E-1")).isEqualTo(-0.4);
    }
}
