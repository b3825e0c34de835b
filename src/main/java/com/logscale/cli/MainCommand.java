package com.logscale.cli;

import com.logscale.config.Constants;
import com.logscale.config.FormatterConfig;
import com.logscale.format.QueryFormatException;
import com.logscale.format.QueryFormatter;
import com.logscale.format.SyntaxTreeDumper;
import com.logscale.query.Diagnostic;
import com.logscale.query.LexToken;
import com.logscale.query.QueryLexer;
import com.logscale.query.QueryParser;
import com.logscale.query.TokenType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Help.Ansi;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

@Command(
    name = "logscale-query",
    description = "解析并格式化 LogScale 查询",
    mixinStandardHelpOptions = true,
    version = "logscale-query " + Constants.TOOL_VERSION,
    subcommands = {
        MainCommand.FormatSubcommand.class,
        MainCommand.ParseSubcommand.class,
        MainCommand.CheckSubcommand.class,
        MainCommand.TokenizeSubcommand.class
    }
)
public class MainCommand implements Callable<Integer> {
    private static final Logger logger = LoggerFactory.getLogger(MainCommand.class);

    @Option(names = {"--width"}, description = "最大行宽", defaultValue = "80")
    private int width = Constants.DEFAULT_MAX_LINE_WIDTH;

    @Option(names = {"--indent"}, description = "每级缩进空格数", defaultValue = "2")
    private int indent = Constants.DEFAULT_INDENT_WIDTH;

    /** 一份待处理的输入；标准输入时 path 为 null */
    record QueryInput(String label, Path path, String content) {
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new MainCommand()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() {
        System.out.println("解析并格式化 LogScale 查询");
        System.out.println("使用 --help 查看帮助信息");
        return 0;
    }

    FormatterConfig toFormatterConfig() {
        FormatterConfig config = FormatterConfig.defaults();
        config.setMaxLineWidth(width);
        config.setIndentWidth(indent);
        return config;
    }

    /**
     * 读取文件列表；列表为空时读取标准输入。
     */
    static List<QueryInput> readInputs(List<Path> files) throws IOException {
        List<QueryInput> inputs = new ArrayList<>();
        if (files == null || files.isEmpty()) {
            String content = new String(System.in.readAllBytes(), StandardCharsets.UTF_8);
            inputs.add(new QueryInput(Constants.STDIN_LABEL, null, content));
            return inputs;
        }
        for (Path file : files) {
            logger.debug("读取输入文件: {}", file);
            inputs.add(new QueryInput(file.toString(), file, Files.readString(file, StandardCharsets.UTF_8)));
        }
        return inputs;
    }

    /**
     * 读取输入并把 I/O 错误转为标准错误输出；失败时返回 null。
     */
    static List<QueryInput> readInputsOrReport(List<Path> files) {
        try {
            return readInputs(files);
        } catch (NoSuchFileException exception) {
            System.err.println("error: file not found: " + exception.getFile());
        } catch (IOException exception) {
            System.err.println("error: " + exception.getMessage());
        }
        return null;
    }

    private static MainCommand orDefaults(MainCommand main) {
        return main == null ? new MainCommand() : main;
    }

    @Command(name = "format", aliases = {"fmt"}, description = "格式化查询文件")
    static class FormatSubcommand implements Callable<Integer> {

        @Parameters(description = "输入文件，省略时读取标准输入", arity = "0..*")
        private List<Path> files;

        @Option(names = {"-i", "--in-place"}, description = "直接改写文件而不是输出到标准输出")
        private boolean inPlace;

        @Option(names = {"--check"}, description = "只检查文件是否已格式化，未格式化时退出码为 1")
        private boolean check;

        @ParentCommand
        private MainCommand main;

        @Override
        public Integer call() {
            if (inPlace && (files == null || files.isEmpty())) {
                System.err.println("error: --in-place requires file arguments");
                return 1;
            }
            List<QueryInput> inputs = readInputsOrReport(files);
            if (inputs == null) {
                return 1;
            }

            QueryFormatter formatter = new QueryFormatter(orDefaults(main).toFormatterConfig());
            int exitCode = 0;
            for (QueryInput input : inputs) {
                String formatted;
                try {
                    formatted = formatter.format(input.content());
                } catch (QueryFormatException exception) {
                    System.err.println("error: " + input.label() + ": " + exception.getMessage());
                    exitCode = 1;
                    continue;
                }

                if (check) {
                    if (!formatted.equals(input.content())) {
                        System.err.println("would reformat " + input.label());
                        exitCode = 1;
                    }
                } else if (inPlace) {
                    if (!formatted.equals(input.content())) {
                        try {
                            Files.writeString(input.path(), formatted, StandardCharsets.UTF_8);
                            logger.debug("已改写: {}", input.label());
                        } catch (IOException exception) {
                            System.err.println("error: " + input.label() + ": " + exception.getMessage());
                            exitCode = 1;
                        }
                    }
                } else {
                    System.out.print(formatted);
                }
            }
            return exitCode;
        }
    }

    @Command(name = "parse", description = "解析查询并输出语法树")
    static class ParseSubcommand implements Callable<Integer> {

        @Parameters(description = "输入文件，省略时读取标准输入", arity = "0..*")
        private List<Path> files;

        @Option(names = {"-o", "--output"}, description = "输出格式 (sexp|json)", defaultValue = "sexp")
        private String output = "sexp";

        @Override
        public Integer call() {
            if (!"sexp".equalsIgnoreCase(output) && !"json".equalsIgnoreCase(output)) {
                System.err.println("error: unsupported output format: " + output);
                return 1;
            }
            List<QueryInput> inputs = readInputsOrReport(files);
            if (inputs == null) {
                return 1;
            }

            SyntaxTreeDumper dumper = new SyntaxTreeDumper();
            for (QueryInput input : inputs) {
                if (inputs.size() > 1) {
                    System.out.println("==> " + input.label() + " <==");
                }
                QueryParser.ParseResult result = new QueryParser().parse(input.content());
                if ("json".equalsIgnoreCase(output)) {
                    try {
                        System.out.println(dumper.toJson(result));
                    } catch (IOException exception) {
                        System.err.println("error: " + input.label() + ": " + exception.getMessage());
                        return 1;
                    }
                } else {
                    System.out.println(dumper.toSexp(result));
                }
            }
            return 0;
        }
    }

    @Command(name = "check", description = "检查查询是否存在语法错误")
    static class CheckSubcommand implements Callable<Integer> {

        @Parameters(description = "输入文件，省略时读取标准输入", arity = "0..*")
        private List<Path> files;

        @Override
        public Integer call() {
            List<QueryInput> inputs = readInputsOrReport(files);
            if (inputs == null) {
                return 1;
            }

            int exitCode = 0;
            for (QueryInput input : inputs) {
                QueryParser.ParseResult result = new QueryParser().parse(input.content());
                if (result.hasErrors()) {
                    System.err.println("error: " + input.label() + ": syntax error detected");
                    for (Diagnostic diagnostic : result.diagnostics()) {
                        System.err.println("  " + diagnostic.render(result.source()).replace("\n", "\n  "));
                    }
                    exitCode = 1;
                } else {
                    System.out.println("ok: " + input.label());
                }
            }
            return exitCode;
        }
    }

    @Command(name = "tokenize", aliases = {"tok"}, description = "逐行显示 token 及其类型标签")
    static class TokenizeSubcommand implements Callable<Integer> {
        private static final Map<TokenType, String> TOKEN_STYLES = Map.of(
            TokenType.IDENTIFIER, "cyan",
            TokenType.NUMBER, "yellow",
            TokenType.QUOTED_STRING, "green",
            TokenType.PATTERN, "magenta",
            TokenType.REGEX_BODY, "red",
            TokenType.REGEX_FLAGS, "fg(9)",
            TokenType.COMMENT, "faint"
        );
        private static final String KEYWORD_STYLE = "blue";
        private static final String DEFAULT_STYLE = "white";
        private static final String SEPARATOR = "  ";

        @Parameters(description = "输入文件，省略时读取标准输入", arity = "0..*")
        private List<Path> files;

        @Option(names = {"--no-color"}, description = "关闭彩色输出")
        private boolean noColor;

        @Override
        public Integer call() {
            List<QueryInput> inputs = readInputsOrReport(files);
            if (inputs == null) {
                return 1;
            }

            Ansi ansi = noColor ? Ansi.OFF : Ansi.AUTO;
            for (QueryInput input : inputs) {
                if (inputs.size() > 1) {
                    System.out.println("==> " + input.label() + " <==");
                }
                for (String line : input.content().split("\\R", -1)) {
                    if (line.isBlank()) {
                        continue;
                    }
                    System.out.print(renderLine(line, ansi));
                }
            }
            return 0;
        }

        /**
         * 每个 token 占一列，上一行为类型标签，下一行为原文，两行按列左对齐。
         */
        String renderLine(String line, Ansi ansi) {
            StringBuilder labels = new StringBuilder();
            StringBuilder texts = new StringBuilder();
            Iterator<LexToken> tokens = QueryLexer.tokenize(line);
            boolean first = true;
            while (tokens.hasNext()) {
                LexToken token = tokens.next();
                String text = line.substring(token.startOffset(), token.endOffset());
                String label = labelOf(token.type(), text);
                int columnWidth = Math.max(label.length(), text.length());
                if (!first) {
                    labels.append(SEPARATOR);
                    texts.append(SEPARATOR);
                }
                first = false;
                labels.append(ansi.string("@|" + styleOf(token.type()) + " " + label + "|@"));
                labels.append(padding(label, columnWidth));
                texts.append(text).append(padding(text, columnWidth));
            }
            return labels.toString().stripTrailing() + "\n" + texts.toString().stripTrailing() + "\n";
        }

        /**
         * 标签与原文相同（如标点）时改用枚举名，避免两行内容重复。
         */
        private static String labelOf(TokenType type, String text) {
            String label = type.label();
            if (label.equals(text)) {
                return type.name().toLowerCase();
            }
            return label;
        }

        private static String styleOf(TokenType type) {
            if (type.isKeyword()) {
                return KEYWORD_STYLE;
            }
            return TOKEN_STYLES.getOrDefault(type, DEFAULT_STYLE);
        }

        private static String padding(String text, int width) {
            return " ".repeat(Math.max(0, width - text.length()));
        }
    }
}
