package com.clausesplit.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 语言配置注册表
 *
 * 内置英文与土耳其语预设（classpath 下 languages/*.json），也可在运行时注册或从文件加载。
 */
public class LanguageRegistry {
    private static final Logger logger = LoggerFactory.getLogger(LanguageRegistry.class);

    /** 内置预设的语言代码 */
    public static final List<String> BUILT_IN_LANGUAGES = List.of("en", "tr");

    private static final ObjectMapper MAPPER = new ObjectMapper()
        .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private final Map<String, LanguageProfile> profiles = new ConcurrentHashMap<>();

    /**
     * 创建空注册表。
     */
    public LanguageRegistry() {
    }

    /**
     * 创建已加载全部内置预设的注册表。
     */
    public static LanguageRegistry withBuiltIns() {
        LanguageRegistry registry = new LanguageRegistry();
        for (String language : BUILT_IN_LANGUAGES) {
            registry.register(loadResource("languages/" + language + ".json"));
        }
        return registry;
    }

    /**
     * 注册语言配置，同名语言被覆盖。
     */
    public void register(LanguageProfile profile) {
        String key = normalize(profile.language());
        LanguageProfile previous = profiles.put(key, profile);
        if (previous != null) {
            logger.info("语言配置已覆盖: {}", key);
        } else {
            logger.info("语言配置已注册: {} (model={})", key, profile.parserModel());
        }
    }

    /**
     * 从 JSON 文件读取语言配置并注册。
     */
    public LanguageProfile load(Path profileFile) throws IOException {
        try (InputStream input = Files.newInputStream(profileFile)) {
            LanguageProfile profile = MAPPER.readValue(input, LanguageProfile.class);
            register(profile);
            return profile;
        }
    }

    /**
     * 查找语言配置，不存在时抛出 UnsupportedLanguageException。
     */
    public LanguageProfile get(String language) {
        LanguageProfile profile = profiles.get(normalize(language));
        if (profile == null) {
            throw new UnsupportedLanguageException(language, profiles.keySet());
        }
        return profile;
    }

    public boolean supports(String language) {
        return profiles.containsKey(normalize(language));
    }

    public Set<String> languages() {
        return Set.copyOf(profiles.keySet());
    }

    private static LanguageProfile loadResource(String resource) {
        try (InputStream input = LanguageRegistry.class.getClassLoader().getResourceAsStream(resource)) {
            if (input == null) {
                throw new UncheckedIOException(new IOException("内置语言配置缺失: " + resource));
            }
            return MAPPER.readValue(input, LanguageProfile.class);
        } catch (IOException exception) {
            throw new UncheckedIOException("读取内置语言配置失败: " + resource, exception);
        }
    }

    private static String normalize(String language) {
        return language == null ? "" : language.trim().toLowerCase(Locale.ROOT);
    }
}
