package com.ftsquery.tree;

import com.ftsquery.ast.QueryNode;

import java.util.List;

/**
 * 遍历中的一步：从根到父节点的祖先链（根在前）以及当前节点。
 */
public record WalkStep(List<QueryNode> ancestors, QueryNode node) {

    public WalkStep {
        ancestors = List.copyOf(ancestors);
    }

    public int depth() {
        return ancestors.size();
    }
}
