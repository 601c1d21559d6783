package org.dxworks.mdblocks.parser;

import org.dxworks.mdblocks.MdBlocksConfig;
import org.dxworks.mdblocks.model.Blockquote;
import org.dxworks.mdblocks.model.FencedCodeBlock;
import org.dxworks.mdblocks.model.IndentedCodeBlock;
import org.dxworks.mdblocks.model.ListBlock;
import org.dxworks.mdblocks.model.ListItem;
import org.dxworks.mdblocks.model.Node;
import org.dxworks.mdblocks.model.Paragraph;
import org.dxworks.mdblocks.model.ThematicBreak;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTimeout;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ListParsingTest {

    private static List<Node> parse(String text) {
        return MarkdownBlockParser.parseDocument(text).children;
    }

    private static ListBlock onlyList(String text) {
        List<Node> blocks = parse(text);
        assertEquals(1, blocks.size(), "expected a single block");
        return assertInstanceOf(ListBlock.class, blocks.get(0));
    }

    private static String paragraphText(ListItem item, int index) {
        return assertInstanceOf(Paragraph.class, item.children.get(index)).literal();
    }

    @Test
    void bulletListIsTight() {
        ListBlock list = onlyList("- a\n- b\n- c");

        assertFalse(list.ordered);
        assertNull(list.start);
        assertEquals("-", list.marker);
        assertTrue(list.tight);
        assertEquals(3, list.items.size());
        assertEquals("c", paragraphText(list.items.get(2), 0));
    }

    @Test
    void orderedListKeepsStartAndDelimiter() {
        ListBlock list = onlyList("3) three\n4) four");

        assertTrue(list.ordered);
        assertEquals(Integer.valueOf(3), list.start);
        assertEquals(")", list.marker);
        assertEquals(2, list.items.size());
    }

    @Test
    void blankLineBetweenItemsMakesListLoose() {
        ListBlock list = onlyList("- a\n\n- b");

        assertFalse(list.tight);
        assertEquals(2, list.items.size());
    }

    @ParameterizedTest
    @ValueSource(ints = {1, 2, 5})
    void blankLinesNeverCloseListBeforeSameKindMarker(int blankLines) {
        ListBlock list = onlyList("* a\n" + "\n".repeat(blankLines) + "* b");

        assertEquals(2, list.items.size());
        assertFalse(list.tight);
    }

    @Test
    void trailingBlankLinesDoNotLoosenList() {
        ListBlock list = onlyList("- a\n- b\n\n\n");

        assertTrue(list.tight);
    }

    @Test
    void secondParagraphInItemMakesListLoose() {
        ListBlock list = onlyList("- foo\n\n  bar");

        assertEquals(1, list.items.size());
        assertFalse(list.tight);
        ListItem item = list.items.get(0);
        assertEquals(2, item.children.size());
        assertEquals("foo", paragraphText(item, 0));
        assertEquals("bar", paragraphText(item, 1));
    }

    @Test
    void listContextCollectsIndentStrippedContent() {
        ContainerExtractor extractor = new ContainerExtractor(MdBlocksConfig.defaults(), 1);
        ListContext context = new ListContext(extractor, LineClassifiers.listMarker("- foo").header());
        context.accept(SourceLine.of(""));
        context.accept(SourceLine.of("  bar"));

        assertEquals(1, context.items().size());
        assertEquals("foo\n\nbar", SourceLines.join(context.items().get(0).lines()));
    }

    @Test
    void deeplyNestedContinuationAfterBlankLinesIsParagraphNotCode() {
        ListBlock outer = onlyList("- foo\n  - bar\n    - baz\n\n\n      bim");

        ListItem fooItem = outer.items.get(0);
        assertEquals("foo", paragraphText(fooItem, 0));
        ListBlock middle = assertInstanceOf(ListBlock.class, fooItem.children.get(1));
        ListItem barItem = middle.items.get(0);
        assertEquals("bar", paragraphText(barItem, 0));
        ListBlock inner = assertInstanceOf(ListBlock.class, barItem.children.get(1));
        ListItem bazItem = inner.items.get(0);

        assertEquals(2, bazItem.children.size());
        assertEquals("baz", paragraphText(bazItem, 0));
        assertEquals("bim", paragraphText(bazItem, 1));
        assertTrue(outer.tight);
        assertTrue(middle.tight);
        assertFalse(inner.tight);
    }

    @Test
    void itemEndingInNestedListFollowedByNextItemIsTight() {
        ListBlock list = onlyList("- a\n  - b\n- c");

        assertTrue(list.tight);
        assertEquals(2, list.items.size());
        ListBlock nested = assertInstanceOf(ListBlock.class, list.items.get(0).children.get(1));
        assertTrue(nested.tight);
    }

    @Test
    void differentBulletCharStartsNewList() {
        List<Node> blocks = parse("- a\n+ b\n* c");

        assertEquals(3, blocks.size());
        assertEquals("+", ((ListBlock) blocks.get(1)).marker);
    }

    @Test
    void differentOrderedDelimiterStartsNewList() {
        List<Node> blocks = parse("1. a\n2) b");

        assertEquals(2, blocks.size());
        assertEquals(Integer.valueOf(2), ((ListBlock) blocks.get(1)).start);
    }

    @Test
    void thematicBreakClosesList() {
        List<Node> blocks = parse("- a\n- b\n* * *\n- c");

        assertEquals(3, blocks.size());
        assertInstanceOf(ThematicBreak.class, blocks.get(1));
    }

    @Test
    void lazyLineContinuesItemParagraph() {
        ListBlock list = onlyList("- a\nb\n- c");

        assertEquals(2, list.items.size());
        assertEquals("a\nb", paragraphText(list.items.get(0), 0));
    }

    @Test
    void unindentedLineAfterBlankClosesList() {
        List<Node> blocks = parse("- a\n\nb");

        assertEquals(2, blocks.size());
        assertTrue(((ListBlock) blocks.get(0)).tight);
        assertInstanceOf(Paragraph.class, blocks.get(1));
    }

    @Test
    void listInterruptsParagraph() {
        List<Node> blocks = parse("text\n- item");

        assertEquals(2, blocks.size());
        assertInstanceOf(ListBlock.class, blocks.get(1));
    }

    @Test
    void orderedListNotStartingAtOneDoesNotInterruptParagraph() {
        List<Node> blocks = parse("The number of windows in my house is\n14.  The number of doors is 6.");

        assertEquals(1, blocks.size());
        assertInstanceOf(Paragraph.class, blocks.get(0));
    }

    @Test
    void emptyItemDoesNotInterruptParagraph() {
        List<Node> blocks = parse("foo\n*\nbar");

        assertEquals(1, blocks.size());
        assertEquals("foo\n*\nbar", ((Paragraph) blocks.get(0)).literal());
    }

    @Test
    void emptyMarkerFollowedByIndentedContent() {
        ListBlock list = onlyList("-\n  foo");

        assertEquals("foo", paragraphText(list.items.get(0), 0));
    }

    @Test
    void emptyItemCannotContinueAfterBlankLine() {
        List<Node> blocks = parse("-\n\n  foo");

        assertEquals(2, blocks.size());
        assertTrue(((ListBlock) blocks.get(0)).items.get(0).children.isEmpty());
        assertInstanceOf(Paragraph.class, blocks.get(1));
    }

    @Test
    void fencedCodeWithBlankLineKeepsListTight() {
        ListBlock list = onlyList("- ```\n  code\n\n  more\n  ```\n- next");

        assertTrue(list.tight);
        FencedCodeBlock code = assertInstanceOf(FencedCodeBlock.class, list.items.get(0).children.get(0));
        assertEquals("code\n\nmore", code.content);
    }

    @Test
    void indentedCodeInsideItem() {
        ListBlock list = onlyList("1.  a\n\n        code");

        ListItem item = list.items.get(0);
        assertEquals("a", paragraphText(item, 0));
        assertEquals("code", assertInstanceOf(IndentedCodeBlock.class, item.children.get(1)).content);
        assertFalse(list.tight);
    }

    @Test
    void blockquoteInsideItemWithLazyLine() {
        ListBlock list = onlyList("- > quote\ncontinued");

        Blockquote quote = assertInstanceOf(Blockquote.class, list.items.get(0).children.get(0));
        assertEquals("quote\ncontinued", ((Paragraph) quote.children.get(0)).literal());
    }

    @Test
    void blankLinesInsideNestedBlockquoteDoNotLoosenOuterList() {
        ListBlock list = onlyList("- > a\n  >\n  > b\n- c");

        assertTrue(list.tight);
        Blockquote quote = assertInstanceOf(Blockquote.class, list.items.get(0).children.get(0));
        assertEquals(2, quote.children.size());
    }

    @Test
    void wideMarkerSpacingIsClampedToFour() {
        ListBlock list = onlyList("-     item\n     more");

        assertEquals("item\nmore", paragraphText(list.items.get(0), 0));
    }

    @Test
    void orderedMarkerAfterBulletItemStartsNewList() {
        List<Node> blocks = parse("- a\n2. b");

        assertEquals(2, blocks.size());
        ListBlock bullets = assertInstanceOf(ListBlock.class, blocks.get(0));
        assertEquals("a", paragraphText(bullets.items.get(0), 0));
        ListBlock ordered = assertInstanceOf(ListBlock.class, blocks.get(1));
        assertTrue(ordered.ordered);
        assertEquals(Integer.valueOf(2), ordered.start);
        assertEquals("b", paragraphText(ordered.items.get(0), 0));
    }

    @Test
    void otherDelimiterNotAtOneStartsNewList() {
        List<Node> blocks = parse("1. a\n2) b");

        assertEquals(2, blocks.size());
        assertEquals("a", paragraphText(((ListBlock) blocks.get(0)).items.get(0), 0));
        assertEquals(")", assertInstanceOf(ListBlock.class, blocks.get(1)).marker);
    }

    @Test
    void emptyMarkerOfOtherBulletStartsNewList() {
        List<Node> blocks = parse("- a\n+");

        assertEquals(2, blocks.size());
        assertEquals("a", paragraphText(((ListBlock) blocks.get(0)).items.get(0), 0));
        ListBlock second = assertInstanceOf(ListBlock.class, blocks.get(1));
        assertEquals("+", second.marker);
        assertTrue(second.items.get(0).children.isEmpty());
    }

    @Test
    void tabAfterMarkerReachesNextTabStop() {
        ListBlock list = onlyList("-\tfoo\n\t- bar");

        ListItem item = list.items.get(0);
        assertEquals("foo", paragraphText(item, 0));
        ListBlock nested = assertInstanceOf(ListBlock.class, item.children.get(1));
        assertEquals("bar", paragraphText(nested.items.get(0), 0));
    }

    @Test
    void tabIndentedParagraphAfterBlankStaysInItem() {
        ListBlock list = onlyList("*\tfoo\n\n\tbar");

        assertFalse(list.tight);
        assertEquals("bar", paragraphText(list.items.get(0), 1));
    }

    @Test
    void alternatingIndentedAndLazyLinesStayLinear() {
        String text = "- a\n" + "  b\nc\n".repeat(16_000);

        ListBlock list = assertTimeout(Duration.ofSeconds(3), () -> onlyList(text));

        assertEquals(32_001, paragraphText(list.items.get(0), 0).split("\n").length);
    }
}
