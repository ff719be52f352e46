package com.termindex.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.termindex.codec.Field;
import com.termindex.codec.FieldKey;
import com.termindex.codec.TermMetadata;
import com.termindex.codec.TermType;
import com.termindex.codec.Terms;
import com.termindex.config.Constants;
import com.termindex.config.IndexConfig;
import com.termindex.index.FieldIterator;
import com.termindex.index.KvTermIndex;
import com.termindex.index.PostingValue;
import com.termindex.index.RangeOpts;
import com.termindex.index.SortOrder;
import com.termindex.kv.SortedFileStore;
import com.termindex.posting.PostingList;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.Callable;

@Command(
    name = "tix",
    description = "🔍 有序存储倒排索引查询工具",
    mixinStandardHelpOptions = true,
    version = "1.0.0",
    subcommands = {
        MainCommand.MatchTermsSubcommand.class,
        MainCommand.MatchFieldSubcommand.class,
        MainCommand.RangeSubcommand.class,
        MainCommand.TermsSubcommand.class,
        MainCommand.StatusSubcommand.class
    }
)
public class MainCommand implements Callable<Integer> {

    @Option(names = {"--store"}, description = "有序存储文件路径（覆盖配置文件）")
    private Path storeFile;

    @Option(names = {"--config"}, description = "JSON 配置文件路径")
    private Path configFile;

    public static void main(String[] args) {
        int exitCode = new CommandLine(new MainCommand()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() {
        System.out.println("🔍 有序存储倒排索引查询工具");
        System.out.println("使用 --help 查看帮助信息");
        return 0;
    }

    /**
     * 合并配置文件与命令行参数，命令行优先。
     */
    IndexConfig resolveConfig() throws IOException {
        IndexConfig config = configFile != null ? IndexConfig.load(configFile) : IndexConfig.defaults();
        if (storeFile != null) {
            config.setStoreFile(storeFile);
        }
        return config;
    }

    private int sanitizeTermLimit(int rawLimit) {
        if (rawLimit <= 0) {
            System.err.printf("⚠️ limit=%d 非法，已使用默认值 %d%n", rawLimit, Constants.DEFAULT_TERM_LIMIT);
            return Constants.DEFAULT_TERM_LIMIT;
        }
        if (rawLimit > Constants.MAX_TERM_LIMIT) {
            System.err.printf("⚠️ limit=%d 超过上限 %d，已自动限制%n", rawLimit, Constants.MAX_TERM_LIMIT);
            return Constants.MAX_TERM_LIMIT;
        }
        return rawLimit;
    }

    /**
     * 按字段类型把命令行文本转换为逻辑词项。
     */
    static byte[] parseTerm(TermMetadata termMetadata, int fieldId, String raw) {
        if (raw == null) {
            return null;
        }
        if (termMetadata.typeOf(fieldId) == TermType.INT64) {
            try {
                return Terms.of(Long.parseLong(raw.trim()));
            } catch (NumberFormatException exception) {
                throw new IllegalArgumentException("字段 " + fieldId + " 为 INT64 类型，无法解析词项: " + raw, exception);
            }
        }
        return Terms.of(raw);
    }

    static void printJson(QueryOutput output) throws IOException {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        System.out.println(mapper.writerWithDefaultPrettyPrinter().writeValueAsString(output));
    }

    static void printPostingList(String label, PostingList postingList, long elapsedMs) {
        System.out.println("🔎 " + label);
        if (postingList.isEmpty()) {
            System.out.println("⚠️ 未找到匹配条目");
        } else {
            System.out.println("   " + String.join(", ", QueryOutput.render(postingList)));
        }
        System.out.println("📊 共 " + postingList.len() + " 个条目，用时 " + elapsedMs + "ms");
    }

    /**
     * 字段定位参数。
     */
    static class FieldOptions {
        @Option(names = {"-s", "--shard"}, description = "分片ID", defaultValue = "0")
        int shardId;

        @Option(names = {"-F", "--field"}, description = "字段ID", required = true)
        int fieldId;

        FieldKey toFieldKey() {
            return FieldKey.of(shardId, fieldId);
        }
    }

    /**
     * 词项范围参数，边界默认包含。
     */
    static class RangeOptions {
        @Option(names = {"--lower"}, description = "下界词项")
        String lower;

        @Option(names = {"--upper"}, description = "上界词项")
        String upper;

        @Option(names = {"--lower-exclusive"}, description = "排除下界")
        boolean lowerExclusive;

        @Option(names = {"--upper-exclusive"}, description = "排除上界")
        boolean upperExclusive;

        RangeOpts toRangeOpts(TermMetadata termMetadata, int fieldId) {
            return RangeOpts.between(
                parseTerm(termMetadata, fieldId, lower), !lowerExclusive,
                parseTerm(termMetadata, fieldId, upper), !upperExclusive);
        }
    }

    @Command(name = "match-terms", description = "🎯 精确匹配词项")
    static class MatchTermsSubcommand implements Callable<Integer> {

        @Mixin
        private FieldOptions fieldOptions;

        @Parameters(description = "词项", arity = "1")
        private String term;

        @Option(names = {"-f", "--format"}, description = "输出格式 (text|json)", defaultValue = "text")
        private String format;

        @ParentCommand
        private MainCommand main;

        @Override
        public Integer call() {
            try {
                IndexConfig config = main.resolveConfig();
                TermMetadata termMetadata = config.toTermMetadata();
                FieldKey fieldKey = fieldOptions.toFieldKey();
                byte[] termBytes = parseTerm(termMetadata, fieldKey.fieldId(), term);
                try (SortedFileStore store = new SortedFileStore(config.getStoreFile().toFile())) {
                    long start = System.currentTimeMillis();
                    PostingList result = new KvTermIndex(store, termMetadata).matchTerms(Field.of(fieldKey, termBytes));
                    long elapsed = System.currentTimeMillis() - start;
                    String label = "match-terms " + fieldKey + " = \"" + term + "\"";
                    if ("json".equalsIgnoreCase(format)) {
                        printJson(new QueryOutput(label, fieldKey.toString(), result.len(), QueryOutput.render(result),
                            List.of(), elapsed, Instant.now()));
                    } else {
                        printPostingList(label, result, elapsed);
                    }
                }
                return 0;
            } catch (Exception exception) {
                System.err.println("❌ 查询失败: " + exception.getMessage());
                return 1;
            }
        }
    }

    @Command(name = "match-field", description = "🌐 字段级通配匹配")
    static class MatchFieldSubcommand implements Callable<Integer> {

        @Mixin
        private FieldOptions fieldOptions;

        @Option(names = {"-f", "--format"}, description = "输出格式 (text|json)", defaultValue = "text")
        private String format;

        @ParentCommand
        private MainCommand main;

        @Override
        public Integer call() {
            try {
                IndexConfig config = main.resolveConfig();
                FieldKey fieldKey = fieldOptions.toFieldKey();
                try (SortedFileStore store = new SortedFileStore(config.getStoreFile().toFile())) {
                    long start = System.currentTimeMillis();
                    PostingList result = new KvTermIndex(store, config.toTermMetadata()).matchField(fieldKey);
                    long elapsed = System.currentTimeMillis() - start;
                    String label = "match-field " + fieldKey;
                    if ("json".equalsIgnoreCase(format)) {
                        printJson(new QueryOutput(label, fieldKey.toString(), result.len(), QueryOutput.render(result),
                            List.of(), elapsed, Instant.now()));
                    } else {
                        printPostingList(label, result, elapsed);
                    }
                }
                return 0;
            } catch (Exception exception) {
                System.err.println("❌ 查询失败: " + exception.getMessage());
                return 1;
            }
        }
    }

    @Command(name = "range", description = "📏 词项范围匹配")
    static class RangeSubcommand implements Callable<Integer> {

        @Mixin
        private FieldOptions fieldOptions;

        @Mixin
        private RangeOptions rangeOptions;

        @Option(names = {"-f", "--format"}, description = "输出格式 (text|json)", defaultValue = "text")
        private String format;

        @ParentCommand
        private MainCommand main;

        @Override
        public Integer call() {
            try {
                IndexConfig config = main.resolveConfig();
                TermMetadata termMetadata = config.toTermMetadata();
                FieldKey fieldKey = fieldOptions.toFieldKey();
                RangeOpts range = rangeOptions.toRangeOpts(termMetadata, fieldKey.fieldId());
                try (SortedFileStore store = new SortedFileStore(config.getStoreFile().toFile())) {
                    long start = System.currentTimeMillis();
                    PostingList result = new KvTermIndex(store, termMetadata).range(fieldKey, range);
                    long elapsed = System.currentTimeMillis() - start;
                    String label = "range " + fieldKey + " " + describe(rangeOptions);
                    if ("json".equalsIgnoreCase(format)) {
                        printJson(new QueryOutput(label, fieldKey.toString(), result.len(), QueryOutput.render(result),
                            List.of(), elapsed, Instant.now()));
                    } else {
                        printPostingList(label, result, elapsed);
                    }
                }
                return 0;
            } catch (Exception exception) {
                System.err.println("❌ 查询失败: " + exception.getMessage());
                return 1;
            }
        }
    }

    @Command(name = "terms", description = "📜 逐词项列出倒排列表")
    static class TermsSubcommand implements Callable<Integer> {

        @Mixin
        private FieldOptions fieldOptions;

        @Mixin
        private RangeOptions rangeOptions;

        @Option(names = {"--desc"}, description = "按词项降序输出")
        private boolean descending;

        @Option(names = {"-l", "--limit"}, description = "最多输出的词项数量（默认取配置 termLimit）")
        private Integer limit;

        @Option(names = {"-f", "--format"}, description = "输出格式 (text|json)", defaultValue = "text")
        private String format;

        @ParentCommand
        private MainCommand main;

        @Override
        public Integer call() {
            try {
                IndexConfig config = main.resolveConfig();
                TermMetadata termMetadata = config.toTermMetadata();
                FieldKey fieldKey = fieldOptions.toFieldKey();
                RangeOpts range = rangeOptions.toRangeOpts(termMetadata, fieldKey.fieldId());
                int effectiveLimit = main.sanitizeTermLimit(limit == null ? config.getTermLimit() : limit);
                TermType termType = termMetadata.typeOf(fieldKey.fieldId());

                List<QueryOutput.TermOutput> terms = new ArrayList<>();
                long start = System.currentTimeMillis();
                try (SortedFileStore store = new SortedFileStore(config.getStoreFile().toFile());
                     FieldIterator iterator = new KvTermIndex(store, termMetadata)
                         .iterator(fieldKey, range, descending ? SortOrder.DESC : SortOrder.ASC)) {
                    while (terms.size() < effectiveLimit && iterator.next()) {
                        PostingValue value = iterator.value();
                        terms.add(new QueryOutput.TermOutput(Terms.render(termType, value.term()),
                            value.value().len(), QueryOutput.render(value.value())));
                    }
                }
                long elapsed = System.currentTimeMillis() - start;

                if ("json".equalsIgnoreCase(format)) {
                    long hits = terms.stream().mapToLong(QueryOutput.TermOutput::hits).sum();
                    printJson(new QueryOutput("terms " + fieldKey + " " + describe(rangeOptions), fieldKey.toString(),
                        hits, List.of(), terms, elapsed, Instant.now()));
                    return 0;
                }
                if (terms.isEmpty()) {
                    System.out.println("⚠️ 未找到匹配词项");
                }
                for (QueryOutput.TermOutput term : terms) {
                    System.out.printf("%s (%d): %s%n", term.term(), term.hits(), String.join(", ", term.itemIds()));
                }
                System.out.println("📊 共 " + terms.size() + " 个词项，用时 " + elapsed + "ms");
                return 0;
            } catch (Exception exception) {
                System.err.println("❌ 遍历失败: " + exception.getMessage());
                return 1;
            }
        }
    }

    @Command(name = "status", description = "📊 查看存储文件信息")
    static class StatusSubcommand implements Callable<Integer> {

        @ParentCommand
        private MainCommand main;

        @Override
        public Integer call() {
            try {
                IndexConfig config = main.resolveConfig();
                try (SortedFileStore store = new SortedFileStore(config.getStoreFile().toFile())) {
                    System.out.println("📊 存储状态");
                    System.out.println("═══════════");
                    System.out.println("📁 存储文件: " + config.getStoreFile());
                    System.out.println("📄 条目总数: " + store.size());
                    System.out.println("🔤 词项类型: " + config.toTermMetadata());
                    System.out.println("💾 文件大小: " + formatBytes(config.getStoreFile().toFile().length()));
                }
                return 0;
            } catch (Exception exception) {
                System.err.println("❌ 获取状态失败: " + exception.getMessage());
                return 1;
            }
        }

        private String formatBytes(long bytes) {
            if (bytes < 1024) {
                return bytes + " B";
            }
            if (bytes < 1024 * 1024L) {
                return String.format(Locale.ROOT, "%.2f KB", bytes / 1024.0);
            }
            if (bytes < 1024 * 1024L * 1024L) {
                return String.format(Locale.ROOT, "%.2f MB", bytes / (1024.0 * 1024.0));
            }
            return String.format(Locale.ROOT, "%.2f GB", bytes / (1024.0 * 1024.0 * 1024.0));
        }
    }

    private static String describe(RangeOptions options) {
        String lowerText = options.lower == null ? "(-∞" : (options.lowerExclusive ? "(" : "[") + options.lower;
        String upperText = options.upper == null ? "+∞)" : options.upper + (options.upperExclusive ? ")" : "]");
        return lowerText + ", " + upperText;
    }
}
