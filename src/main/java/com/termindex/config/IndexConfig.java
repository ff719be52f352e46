package com.termindex.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.termindex.codec.TermMetadata;
import com.termindex.codec.TermType;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 索引运行时配置
 *
 * 支持从 JSON 配置文件或 CLI 参数注入，覆盖 Constants 默认值
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class IndexConfig {
    private Path storeFile = Paths.get("./index.tikv");
    private TermType defaultTermType = TermType.STRING;
    private Map<Integer, TermType> fieldTermTypes = new LinkedHashMap<>();
    private int termLimit = Constants.DEFAULT_TERM_LIMIT;

    public Path getStoreFile() {
        return storeFile;
    }

    public void setStoreFile(Path storeFile) {
        this.storeFile = storeFile;
    }

    public TermType getDefaultTermType() {
        return defaultTermType;
    }

    public void setDefaultTermType(TermType defaultTermType) {
        this.defaultTermType = defaultTermType;
    }

    public Map<Integer, TermType> getFieldTermTypes() {
        return fieldTermTypes;
    }

    public void setFieldTermTypes(Map<Integer, TermType> fieldTermTypes) {
        this.fieldTermTypes = fieldTermTypes == null ? new LinkedHashMap<>() : new LinkedHashMap<>(fieldTermTypes);
    }

    public int getTermLimit() {
        return termLimit;
    }

    public void setTermLimit(int termLimit) {
        this.termLimit = termLimit;
    }

    /**
     * 根据配置构造词项 schema。
     */
    public TermMetadata toTermMetadata() {
        return new TermMetadata(defaultTermType, fieldTermTypes);
    }

    /**
     * 使用默认配置创建实例
     */
    public static IndexConfig defaults() {
        return new IndexConfig();
    }

    /**
     * 从 JSON 文件加载配置，文件中缺省的字段保持默认值。
     *
     * @param configFile 配置文件路径
     * @return 配置实例
     * @throws IOException 文件不存在或格式错误时抛出
     */
    public static IndexConfig load(Path configFile) throws IOException {
        if (configFile == null) {
            throw new IllegalArgumentException("配置文件路径不能为空");
        }
        if (!Files.isRegularFile(configFile)) {
            throw new IOException("配置文件不存在: " + configFile);
        }
        IndexConfig config = new ObjectMapper().readValue(configFile.toFile(), IndexConfig.class);
        if (config.getTermLimit() <= 0) {
            throw new IOException("termLimit 必须为正数: " + config.getTermLimit());
        }
        return config;
    }
}
