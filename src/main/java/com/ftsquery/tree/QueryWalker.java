package com.ftsquery.tree;

import com.ftsquery.ast.FilterMode;
import com.ftsquery.ast.QueryNode;
import com.ftsquery.ast.QueryValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Stream;

/**
 * 查询树遍历与列作用域计算。
 *
 * <p>节点定位使用引用相等：结构相同但不是同一对象的节点视为不在树中。
 */
public final class QueryWalker {
    private static final Logger logger = LoggerFactory.getLogger(QueryWalker.class);

    private QueryWalker() {
        // 工具类，禁止实例化
    }

    /**
     * 自顶向下、从左到右惰性遍历所有节点，根节点最先产出且祖先链为空。
     */
    public static Stream<WalkStep> walk(QueryNode root) {
        if (root == null) {
            throw new QueryValidationException("查询节点不能为 null");
        }
        return walk(List.of(), root);
    }

    private static Stream<WalkStep> walk(List<QueryNode> ancestors, QueryNode node) {
        Stream<WalkStep> self = Stream.of(new WalkStep(ancestors, node));
        List<QueryNode> children = children(node);
        if (children.isEmpty()) {
            return self;
        }
        List<QueryNode> childAncestors = new ArrayList<>(ancestors.size() + 1);
        childAncestors.addAll(ancestors);
        childAncestors.add(node);
        List<QueryNode> frozen = List.copyOf(childAncestors);
        return Stream.concat(self, children.stream().flatMap(child -> walk(frozen, child)));
    }

    /**
     * 直接子节点。NEAR 的子节点是其 PHRASES，NOT 先 match 后 no_match。
     */
    static List<QueryNode> children(QueryNode node) {
        if (node instanceof QueryNode.Phrases phrases) {
            return List.copyOf(phrases.phrases());
        }
        if (node instanceof QueryNode.Near near) {
            return List.of(near.phrases());
        }
        if (node instanceof QueryNode.ColumnFilter columnFilter) {
            return List.of(columnFilter.query());
        }
        if (node instanceof QueryNode.And and) {
            return and.queries();
        }
        if (node instanceof QueryNode.Or or) {
            return or.queries();
        }
        if (node instanceof QueryNode.Not not) {
            return List.of(not.match(), not.noMatch());
        }
        return List.of();
    }

    /**
     * 取出子树，并用其所有祖先列过滤器（保持嵌套顺序）包裹，使其可作为独立查询执行。
     *
     * <p>需要包裹时，带 sequence 的短语脱离 PHRASES 后不再有前一个短语，sequence 被清除。
     */
    public static QueryNode extractWithColumnFilters(QueryNode node, QueryNode root) {
        WalkStep step = locate(node, root);
        QueryNode result = node;
        List<QueryNode> ancestors = step.ancestors();
        for (int index = ancestors.size() - 1; index >= 0; index--) {
            if (ancestors.get(index) instanceof QueryNode.ColumnFilter columnFilter) {
                if (result instanceof QueryNode.Phrase phrase && phrase.sequence()) {
                    result = phrase.withSequence(false);
                }
                result = new QueryNode.ColumnFilter(columnFilter.columns(), columnFilter.filter(), result);
            }
        }
        return result;
    }

    /**
     * 计算节点可匹配的列：从全部候选列出发，自根向下依次应用祖先列过滤器。
     *
     * <p>列名按 ASCII 不区分大小写匹配，未知列名被忽略；结果保持候选列的原有顺序与写法。
     */
    public static Set<String> applicableColumns(QueryNode node, QueryNode root, Collection<String> allColumns) {
        if (allColumns == null) {
            throw new QueryValidationException("候选列不能为 null");
        }
        WalkStep step = locate(node, root);
        Set<String> working = new LinkedHashSet<>(allColumns);
        for (QueryNode ancestor : step.ancestors()) {
            if (!(ancestor instanceof QueryNode.ColumnFilter columnFilter)) {
                continue;
            }
            Set<String> named = matchColumns(columnFilter.columns(), allColumns);
            if (columnFilter.filter() == FilterMode.INCLUDE) {
                working.retainAll(named);
            } else {
                working.removeAll(named);
            }
        }
        return working;
    }

    private static Set<String> matchColumns(List<String> names, Collection<String> allColumns) {
        Set<String> matched = new LinkedHashSet<>();
        for (String name : names) {
            boolean found = false;
            for (String column : allColumns) {
                if (equalsIgnoreAsciiCase(name, column)) {
                    matched.add(column);
                    found = true;
                }
            }
            if (!found) {
                logger.debug("列过滤器引用了未知列 '{}'，已忽略", name);
            }
        }
        return matched;
    }

    private static WalkStep locate(QueryNode node, QueryNode root) {
        if (node == null) {
            throw new QueryValidationException("查询节点不能为 null");
        }
        return walk(root)
                .filter(step -> step.node() == node)
                .findFirst()
                .orElseThrow(() -> new QueryLookupException("节点不在查询树中: " + node.typeName()));
    }

    static boolean equalsIgnoreAsciiCase(String left, String right) {
        if (left.length() != right.length()) {
            return false;
        }
        for (int index = 0; index < left.length(); index++) {
            if (toLowerAscii(left.charAt(index)) != toLowerAscii(right.charAt(index))) {
                return false;
            }
        }
        return true;
    }

    private static char toLowerAscii(char ch) {
        return ch >= 'A' && ch <= 'Z' ? (char) (ch + ('a' - 'A')) : ch;
    }
}
