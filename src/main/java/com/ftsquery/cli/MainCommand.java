package com.ftsquery.cli;

import com.ftsquery.ast.QueryNode;
import com.ftsquery.ast.QueryValidationException;
import com.ftsquery.codec.QueryDictCodec;
import com.ftsquery.codec.QueryJson;
import com.ftsquery.config.Constants;
import com.ftsquery.config.QueryConfig;
import com.ftsquery.format.QueryFormatter;
import com.ftsquery.query.QueryParseException;
import com.ftsquery.query.QueryParser;
import com.ftsquery.tree.QueryLookupException;
import com.ftsquery.tree.QueryWalker;
import com.ftsquery.tree.WalkStep;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.util.List;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.stream.Collectors;

@Command(
    name = "ftsq",
    description = "🔍 FTS5 全文检索查询语言工具",
    mixinStandardHelpOptions = true,
    version = "1.0.0",
    subcommands = {
        MainCommand.ParseSubcommand.class,
        MainCommand.FormatSubcommand.class,
        MainCommand.FromJsonSubcommand.class,
        MainCommand.WalkSubcommand.class,
        MainCommand.ColumnsSubcommand.class
    }
)
public class MainCommand implements Callable<Integer> {

    @Option(names = {"--max-length"}, description = "查询字符串最大长度",
            defaultValue = "" + Constants.MAX_QUERY_LENGTH)
    private int maxLength = Constants.MAX_QUERY_LENGTH;

    @Option(names = {"--max-depth"}, description = "最大嵌套深度",
            defaultValue = "" + Constants.MAX_NESTING_DEPTH)
    private int maxDepth = Constants.MAX_NESTING_DEPTH;

    public static void main(String[] args) {
        int exitCode = new CommandLine(new MainCommand()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() {
        System.out.println("🔍 FTS5 全文检索查询语言工具");
        System.out.println("使用 --help 查看帮助信息");
        return 0;
    }

    /**
     * 由全局选项构建配置；非法值回退为默认上限。
     */
    QueryConfig buildConfig() {
        QueryConfig config = QueryConfig.defaults();
        if (maxLength <= 0) {
            System.err.printf("⚠️ 非法长度上限 %d，已回退为默认值 %d%n", maxLength, Constants.MAX_QUERY_LENGTH);
        } else {
            config.setMaxQueryLength(maxLength);
        }
        if (maxDepth <= 0) {
            System.err.printf("⚠️ 非法嵌套上限 %d，已回退为默认值 %d%n", maxDepth, Constants.MAX_NESTING_DEPTH);
        } else {
            config.setMaxNestingDepth(maxDepth);
        }
        return config;
    }

    QueryNode parseQuery(String query) {
        return new QueryParser(buildConfig()).parse(query);
    }

    static int reportFailure(String action, RuntimeException exception) {
        System.err.println("❌ " + action + "失败: " + exception.getMessage());
        if (exception instanceof QueryParseException parseException) {
            System.err.println("💡 " + parseException.getSuggestion());
        }
        return 1;
    }

    /**
     * 子树的展示文本。PHRASES 内带 sequence 的短语单独不能输出，展示时补上 "+ "。
     */
    static String display(QueryNode node) {
        if (node instanceof QueryNode.Phrase phrase && phrase.sequence()) {
            return "+ " + QueryFormatter.toQueryString(phrase.withSequence(false));
        }
        return QueryFormatter.toQueryString(node);
    }

    @Command(name = "parse", description = "🧩 解析查询并输出语法树")
    static class ParseSubcommand implements Callable<Integer> {

        @Parameters(description = "查询语句", arity = "1")
        private String query;

        @Option(names = {"-f", "--format"}, description = "输出格式 (json|text)", defaultValue = "json")
        private String format = "json";

        @ParentCommand
        private MainCommand main;

        @Override
        public Integer call() {
            try {
                QueryNode ast = main.parseQuery(query);
                if ("text".equalsIgnoreCase(format)) {
                    System.out.println(QueryFormatter.toQueryString(ast));
                } else {
                    System.out.println(new QueryJson(new QueryDictCodec(main.buildConfig())).toPrettyJson(ast));
                }
                return 0;
            } catch (QueryParseException | QueryValidationException exception) {
                return reportFailure("解析", exception);
            }
        }
    }

    @Command(name = "format", description = "✨ 输出规范化查询文本")
    static class FormatSubcommand implements Callable<Integer> {

        @Parameters(description = "查询语句", arity = "1")
        private String query;

        @ParentCommand
        private MainCommand main;

        @Override
        public Integer call() {
            try {
                System.out.println(QueryFormatter.toQueryString(main.parseQuery(query)));
                return 0;
            } catch (QueryParseException | QueryValidationException exception) {
                return reportFailure("格式化", exception);
            }
        }
    }

    @Command(name = "from-json", description = "📥 由 JSON 字典构建查询并输出规范化文本")
    static class FromJsonSubcommand implements Callable<Integer> {

        @Parameters(description = "JSON 表示的查询", arity = "1")
        private String json;

        @ParentCommand
        private MainCommand main;

        @Override
        public Integer call() {
            try {
                QueryNode ast = new QueryJson(new QueryDictCodec(main.buildConfig())).fromJson(json);
                System.out.println(QueryFormatter.toQueryString(ast));
                return 0;
            } catch (QueryValidationException exception) {
                return reportFailure("转换", exception);
            }
        }
    }

    @Command(name = "walk", description = "🌲 自顶向下列出所有节点")
    static class WalkSubcommand implements Callable<Integer> {

        @Parameters(description = "查询语句", arity = "1")
        private String query;

        @ParentCommand
        private MainCommand main;

        @Override
        public Integer call() {
            try {
                QueryNode ast = main.parseQuery(query);
                QueryWalker.walk(ast).forEach(step -> System.out.println(describe(step)));
                return 0;
            } catch (QueryParseException | QueryValidationException exception) {
                return reportFailure("遍历", exception);
            }
        }

        private static String describe(WalkStep step) {
            return "  ".repeat(step.depth()) + step.node().typeName() + "  " + display(step.node());
        }
    }

    @Command(name = "columns", description = "📋 计算每个短语节点可匹配的列")
    static class ColumnsSubcommand implements Callable<Integer> {

        @Parameters(description = "查询语句", arity = "1")
        private String query;

        @Option(names = {"-c", "--columns"}, description = "全部候选列（逗号分隔）", split = ",", required = true)
        private List<String> columns;

        @ParentCommand
        private MainCommand main;

        @Override
        public Integer call() {
            try {
                QueryNode ast = main.parseQuery(query);
                List<QueryNode> targets = QueryWalker.walk(ast)
                        .map(WalkStep::node)
                        .filter(node -> node instanceof QueryNode.Phrase
                                || node instanceof QueryNode.Phrases
                                || node instanceof QueryNode.Near)
                        .collect(Collectors.toList());
                for (QueryNode target : targets) {
                    Set<String> applicable = QueryWalker.applicableColumns(target, ast, columns);
                    System.out.println(display(target) + " -> " + applicable);
                }
                return 0;
            } catch (QueryParseException | QueryValidationException | QueryLookupException exception) {
                return reportFailure("计算列", exception);
            }
        }
    }
}
