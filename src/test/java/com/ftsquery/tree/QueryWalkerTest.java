package com.ftsquery.tree;

import com.ftsquery.ast.FilterMode;
import com.ftsquery.ast.QueryNode;
import com.ftsquery.ast.QueryNode.ColumnFilter;
import com.ftsquery.ast.QueryNode.Near;
import com.ftsquery.ast.QueryNode.Or;
import com.ftsquery.ast.QueryNode.Phrase;
import com.ftsquery.format.QueryFormatter;
import com.ftsquery.query.QueryParser;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class QueryWalkerTest {

    private static final String SCOPED_QUERY = "a AND {cola colb}:({cold}: string AND -x:NEAR(seven eight))";

    private final QueryParser parser = new QueryParser();

    @Test
    @DisplayName("自顶向下、从左到右遍历")
    void testWalkOrder() {
        QueryNode root = parser.parse("a OR b c NOT d");

        List<WalkStep> steps = QueryWalker.walk(root).collect(Collectors.toList());

        assertEquals(List.of("OR", "PHRASE", "NOT", "PHRASES", "PHRASE", "PHRASE", "PHRASE"),
                steps.stream().map(step -> step.node().typeName()).collect(Collectors.toList()));
        assertEquals(List.of(0, 1, 1, 2, 3, 3, 2),
                steps.stream().map(WalkStep::depth).collect(Collectors.toList()));
        assertSame(root, steps.get(0).node());
        assertTrue(steps.get(0).ancestors().isEmpty());
        assertSame(root, steps.get(4).ancestors().get(0));
    }

    @Test
    @DisplayName("NEAR 的子节点是 PHRASES")
    void testWalkNear() {
        List<String> types = QueryWalker.walk(parser.parse("NEAR(a b)"))
                .map(step -> step.node().typeName())
                .collect(Collectors.toList());
        assertEquals(List.of("NEAR", "PHRASES", "PHRASE", "PHRASE"), types);
    }

    @Test
    @DisplayName("遍历是惰性的，可重复调用")
    void testWalkIsLazyAndRestartable() {
        QueryNode root = parser.parse("a AND b");

        assertSame(root, QueryWalker.walk(root).findFirst().orElseThrow().node());
        assertEquals(3, QueryWalker.walk(root).count());
        assertEquals(3, QueryWalker.walk(root).count());
    }

    @Test
    @DisplayName("祖先链不可修改")
    void testAncestorsImmutable() {
        WalkStep step = QueryWalker.walk(parser.parse("a b")).skip(1).findFirst().orElseThrow();
        assertThrows(UnsupportedOperationException.class, () -> step.ancestors().clear());
    }

    @Test
    @DisplayName("提取子树并保留祖先列过滤器")
    void testExtractWithColumnFilters() {
        QueryNode root = parser.parse(SCOPED_QUERY);
        Near near = findNear(root);

        QueryNode extracted = QueryWalker.extractWithColumnFilters(near, root);

        QueryNode expected = new ColumnFilter(List.of("cola", "colb"), FilterMode.INCLUDE,
                new ColumnFilter(List.of("x"), FilterMode.EXCLUDE, near));
        assertEquals(expected, extracted);
    }

    @Test
    @DisplayName("提取带 + 的短语时清除 sequence，结果可以输出")
    void testExtractSequencePhrase() {
        QueryNode root = parser.parse("title: a + b");
        Phrase b = ((QueryNode.Phrases) ((ColumnFilter) root).query()).phrases().get(1);
        assertTrue(b.sequence());

        QueryNode extracted = QueryWalker.extractWithColumnFilters(b, root);

        assertEquals(new ColumnFilter(List.of("title"), FilterMode.INCLUDE, Phrase.of("b")), extracted);
        assertEquals("title: b", QueryFormatter.toQueryString(extracted));
    }

    @Test
    @DisplayName("没有列过滤器祖先时返回节点本身")
    void testExtractWithoutColumnFilters() {
        QueryNode root = parser.parse("a OR b");
        QueryNode b = ((Or) root).queries().get(1);

        assertSame(b, QueryWalker.extractWithColumnFilters(b, root));
        assertSame(root, QueryWalker.extractWithColumnFilters(root, root));
    }

    @Test
    @DisplayName("列作用域示例")
    void testApplicableColumnsExample() {
        QueryNode root = parser.parse(SCOPED_QUERY);

        Set<String> columns = QueryWalker.applicableColumns(findNear(root), root, List.of("cola", "colb", "cold", "colx"));

        assertEquals(Set.of("cola", "colb"), columns);
    }

    @Test
    @DisplayName("根节点可匹配全部列，保持候选列顺序")
    void testApplicableColumnsAtRoot() {
        QueryNode root = parser.parse("a b");
        List<String> all = List.of("zeta", "alpha", "mid");

        assertEquals(all, List.copyOf(QueryWalker.applicableColumns(root, root, all)));
    }

    @Test
    @DisplayName("列名不区分大小写，排除只会收窄")
    void testApplicableColumnsCaseInsensitive() {
        QueryNode root = parser.parse("{COLA x}: -X: a");
        QueryNode target = ((ColumnFilter) ((ColumnFilter) root).query()).query();

        Set<String> columns = QueryWalker.applicableColumns(target, root, List.of("cola", "x", "colc"));

        assertEquals(Set.of("cola"), columns);
    }

    @Test
    @DisplayName("未知列名被忽略")
    void testUnknownColumnsIgnored() {
        QueryNode root = parser.parse("-nope: a");
        QueryNode target = ((ColumnFilter) root).query();

        assertEquals(Set.of("cola", "colb"), QueryWalker.applicableColumns(target, root, List.of("cola", "colb")));

        QueryNode includeRoot = parser.parse("nope: a");
        QueryNode includeTarget = ((ColumnFilter) includeRoot).query();
        assertTrue(QueryWalker.applicableColumns(includeTarget, includeRoot, List.of("cola")).isEmpty());
    }

    @Test
    @DisplayName("按引用定位结构相同的兄弟节点")
    void testIdentityLookup() {
        QueryNode root = parser.parse("x: a OR y: a");
        Or or = (Or) root;
        QueryNode first = ((ColumnFilter) or.queries().get(0)).query();
        QueryNode second = ((ColumnFilter) or.queries().get(1)).query();
        List<String> all = List.of("x", "y");

        assertEquals(first, second);
        assertEquals(Set.of("x"), QueryWalker.applicableColumns(first, root, all));
        assertEquals(Set.of("y"), QueryWalker.applicableColumns(second, root, all));
    }

    @Test
    @DisplayName("节点不在树中时抛出定位异常")
    void testLookupFailure() {
        QueryNode root = parser.parse("a b");
        Phrase copy = Phrase.of("a");

        assertThrows(QueryLookupException.class, () -> QueryWalker.extractWithColumnFilters(copy, root));
        assertThrows(QueryLookupException.class, () -> QueryWalker.applicableColumns(copy, root, List.of("c")));
    }

    @Test
    @DisplayName("ASCII 大小写比较")
    void testEqualsIgnoreAsciiCase() {
        assertTrue(QueryWalker.equalsIgnoreAsciiCase("Title", "tITLE"));
        assertFalse(QueryWalker.equalsIgnoreAsciiCase("title", "titles"));
        assertFalse(QueryWalker.equalsIgnoreAsciiCase("É", "é"));
    }

    private static Near findNear(QueryNode root) {
        return QueryWalker.walk(root)
                .map(WalkStep::node)
                .filter(Near.class::isInstance)
                .map(Near.class::cast)
                .findFirst()
                .orElseThrow();
    }
}
