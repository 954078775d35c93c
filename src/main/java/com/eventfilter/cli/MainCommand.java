package com.eventfilter.cli;

import com.eventfilter.action.Action;
import com.eventfilter.ast.AggregationFinder;
import com.eventfilter.ast.Expr;
import com.eventfilter.config.CompilerConfig;
import com.eventfilter.filter.FilterCompiler;
import com.eventfilter.filter.FilterException;
import com.eventfilter.filter.FilterSpec;
import com.eventfilter.filter.TeamContext;
import com.eventfilter.json.ExprJson;
import com.eventfilter.json.FilterSpecReader;
import com.eventfilter.registry.TeamCatalog;
import com.eventfilter.selector.CssSelectorRegexCompiler;
import com.eventfilter.splice.FilterPayload;
import com.eventfilter.splice.FilterSplicer;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.Map;
import java.util.concurrent.Callable;

@Command(
    name = "filterc",
    description = "🧩 事件属性过滤编译器",
    mixinStandardHelpOptions = true,
    version = "1.0.0",
    subcommands = {
        MainCommand.CompileSubcommand.class,
        MainCommand.ActionSubcommand.class,
        MainCommand.SpliceSubcommand.class,
        MainCommand.ParseSubcommand.class
    }
)
public class MainCommand implements Callable<Integer> {

    @Option(names = {"--catalog"}, description = "团队目录 JSON 文件（属性类型与 cohort）")
    private Path catalogFile;

    @Option(names = {"--team-id"}, description = "团队 ID，需在团队目录中存在")
    private Long teamId;

    @Option(names = {"--config"}, description = "编译器配置 JSON 文件")
    private Path configFile;

    public static void main(String[] args) {
        int exitCode = new CommandLine(new MainCommand()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() {
        System.out.println("🧩 事件属性过滤编译器");
        System.out.println("使用 --help 查看帮助信息");
        return 0;
    }

    private CompilerConfig loadConfig() throws IOException {
        return configFile == null ? CompilerConfig.defaults() : CompilerConfig.load(configFile);
    }

    private TeamCatalog loadCatalog() throws IOException {
        return catalogFile == null ? TeamCatalog.empty() : TeamCatalog.load(catalogFile);
    }

    private FilterCompiler createCompiler(TeamCatalog catalog, CompilerConfig config) {
        return new FilterCompiler(
            catalog.propertyTypeRegistry(),
            catalog.cohortStore(),
            new CssSelectorRegexCompiler(),
            config
        );
    }

    private TeamContext resolveTeam(TeamCatalog catalog) {
        if (teamId == null) {
            return null;
        }
        return catalog.team(teamId)
            .orElseThrow(() -> new IllegalArgumentException("团队目录中没有团队 " + teamId));
    }

    /**
     * 输入优先取文件，其次取命令行文本。
     */
    private static String readInput(String inlineText, Path file, String what) throws IOException {
        if (file != null) {
            try {
                return Files.readString(file);
            } catch (IOException exception) {
                throw new IOException("读取" + what + "文件失败: " + file.toAbsolutePath(), exception);
            }
        }
        if (inlineText == null || inlineText.isBlank()) {
            throw new IllegalArgumentException("缺少" + what + "，请通过参数或文件提供");
        }
        return inlineText;
    }

    private static int printExpr(Expr expr) {
        System.out.println(ExprJson.writePretty(expr));
        return 0;
    }

    private static int reportFailure(String action, Exception exception) {
        if (exception instanceof FilterException filterException) {
            System.err.println("❌ " + action + "失败 [" + filterException.getKind() + "]: " + exception.getMessage());
        } else {
            System.err.println("❌ " + action + "失败: " + exception.getMessage());
        }
        return 1;
    }

    @Command(name = "compile", description = "🔧 将过滤描述编译为表达式树")
    static class CompileSubcommand implements Callable<Integer> {

        @Parameters(description = "过滤描述 JSON 文本", arity = "0..1")
        private String specJson;

        @Option(names = {"-f", "--file"}, description = "过滤描述 JSON 文件")
        private Path specFile;

        @ParentCommand
        private MainCommand main;

        @Override
        public Integer call() {
            try {
                TeamCatalog catalog = main.loadCatalog();
                FilterCompiler compiler = main.createCompiler(catalog, main.loadConfig());
                FilterSpec spec = FilterSpecReader.read(readInput(specJson, specFile, "过滤描述"));
                Expr expr = compiler.compile(spec, main.resolveTeam(catalog));
                if (AggregationFinder.hasAggregation(expr)) {
                    System.err.println("⚠️ 表达式包含聚合函数，不能直接用于 WHERE 子句");
                }
                return printExpr(expr);
            } catch (FilterException | IOException | IllegalArgumentException exception) {
                return reportFailure("编译", exception);
            }
        }
    }

    @Command(name = "action", description = "🎯 将 action 编译为表达式树")
    static class ActionSubcommand implements Callable<Integer> {

        @Parameters(description = "action JSON 文本", arity = "0..1")
        private String actionJson;

        @Option(names = {"-f", "--file"}, description = "action JSON 文件")
        private Path actionFile;

        @ParentCommand
        private MainCommand main;

        @Override
        public Integer call() {
            try {
                TeamCatalog catalog = main.loadCatalog();
                FilterCompiler compiler = main.createCompiler(catalog, main.loadConfig());
                Action action = FilterSpecReader.readAction(readInput(actionJson, actionFile, "action"));
                return printExpr(compiler.actions().compile(action, main.resolveTeam(catalog)));
            } catch (FilterException | IOException | IllegalArgumentException exception) {
                return reportFailure("编译 action ", exception);
            }
        }
    }

    @Command(name = "splice", description = "🧵 将过滤条件替换进查询模板的 {filters} 占位符")
    static class SpliceSubcommand implements Callable<Integer> {

        @Parameters(description = "查询模板文本", arity = "0..1")
        private String template;

        @Option(names = {"-t", "--template-file"}, description = "查询模板文件")
        private Path templateFile;

        @Option(names = {"--filters"}, description = "替换内容 JSON 文件（properties/date_from/date_to）")
        private Path filtersFile;

        @ParentCommand
        private MainCommand main;

        @Override
        public Integer call() {
            try {
                TeamCatalog catalog = main.loadCatalog();
                CompilerConfig config = main.loadConfig();
                FilterSplicer splicer = new FilterSplicer(main.createCompiler(catalog, config), Clock.systemUTC(), config);
                FilterPayload payload = filtersFile == null ? null : FilterSpecReader.readPayload(filtersFile);
                String templateText = readInput(template, templateFile, "查询模板");
                return printExpr(splicer.splice(templateText, payload, main.resolveTeam(catalog)));
            } catch (FilterException | IOException | IllegalArgumentException exception) {
                return reportFailure("替换", exception);
            }
        }
    }

    @Command(name = "parse", description = "📝 解析表达式或查询文本并输出语法树")
    static class ParseSubcommand implements Callable<Integer> {

        @Parameters(description = "表达式或 SELECT 查询文本", arity = "1")
        private String text;

        @ParentCommand
        private MainCommand main;

        @Override
        public Integer call() {
            try {
                FilterCompiler compiler = main.createCompiler(TeamCatalog.empty(), main.loadConfig());
                return printExpr(compiler.parser().parse(text, Map.of()));
            } catch (FilterException | IOException exception) {
                return reportFailure("解析", exception);
            }
        }
    }
}
