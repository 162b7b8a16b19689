package com.modgud.guard.common;

import com.modgud.guard.CallArguments;
import com.modgud.guard.Guard;
import com.modgud.guard.GuardResult;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Collections;

import static org.assertj.core.api.Assertions.*;

@DisplayName("CommonGuards 测试")
class CommonGuardsTest {

    enum Color {
        RED, GREEN
    }

    private static String check(Guard guard, Object... positional) {
        GuardResult result = guard.check(CallArguments.of(positional));
        return result.getMessage();
    }

    @Nested
    @DisplayName("空值检查")
    class Emptiness {

        @Test
        @DisplayName("notEmpty 检查字符串、集合和数组")
        void testNotEmpty() {
            Guard guard = CommonGuards.notEmpty("name");
            assertThat(check(guard, "bob")).isNull();
            assertThat(check(guard, Arrays.asList(1))).isNull();
            assertThat(check(guard, "")).isEqualTo("name cannot be empty");
            assertThat(check(guard, Collections.emptyList())).isEqualTo("name cannot be empty");
            assertThat(check(guard, Collections.emptyMap())).isEqualTo("name cannot be empty");
            assertThat(check(guard, (Object) new int[0])).isEqualTo("name cannot be empty");
            assertThat(check(guard)).isEqualTo("name cannot be empty");
        }

        @Test
        @DisplayName("notEmpty 对其他值按真值判断")
        void testNotEmptyTruthiness() {
            Guard guard = CommonGuards.notEmpty("flag");
            assertThat(check(guard, 0)).isEqualTo("flag cannot be empty");
            assertThat(check(guard, false)).isEqualTo("flag cannot be empty");
            assertThat(check(guard, 3)).isNull();
            assertThat(check(guard, new Object())).isNull();
        }

        @Test
        @DisplayName("notEmpty 可指定位置")
        void testNotEmptyPosition() {
            Guard guard = CommonGuards.notEmpty("second", 1);
            assertThat(check(guard, "", "x")).isNull();
            assertThat(check(guard, "x", "")).isEqualTo("second cannot be empty");
        }

        @Test
        @DisplayName("notNull")
        void testNotNull() {
            Guard guard = CommonGuards.notNull("value");
            assertThat(check(guard, 0)).isNull();
            assertThat(check(guard, (Object) null)).isEqualTo("value cannot be null");
            assertThat(guard.check(CallArguments.empty().withKeyword("value", "x")).isPassed()).isTrue();
        }
    }

    @Nested
    @DisplayName("数值检查")
    class Numbers {

        @Test
        @DisplayName("positive")
        void testPositive() {
            Guard guard = CommonGuards.positive("amount");
            assertThat(check(guard, 1)).isNull();
            assertThat(check(guard, 0.5)).isNull();
            assertThat(check(guard, 0)).isEqualTo("amount must be positive");
            assertThat(check(guard, -2L)).isEqualTo("amount must be positive");
            assertThat(check(guard, "10")).isEqualTo("amount must be positive");
            assertThat(check(guard)).isEqualTo("amount must be positive");
        }

        @Test
        @DisplayName("inRange 包含边界")
        void testInRange() {
            Guard guard = CommonGuards.inRange(1, 10, "level");
            assertThat(check(guard, 1)).isNull();
            assertThat(check(guard, 10)).isNull();
            assertThat(check(guard, 5.5)).isNull();
            assertThat(check(guard, 0)).isEqualTo("level must be between 1 and 10");
            assertThat(check(guard, 11)).isEqualTo("level must be between 1 and 10");
            assertThat(check(guard)).isEqualTo("level must be between 1 and 10");
            assertThat(check(CommonGuards.inRange(0.5, 1.5, "ratio"), 2)).isEqualTo("ratio must be between 0.5 and 1.5");
        }
    }

    @Nested
    @DisplayName("类型与格式")
    class TypesAndFormats {

        @Test
        @DisplayName("typeCheck")
        void testTypeCheck() {
            Guard guard = CommonGuards.typeCheck(CharSequence.class, "text");
            assertThat(check(guard, "abc")).isNull();
            assertThat(check(guard, new StringBuilder("abc"))).isNull();
            assertThat(check(guard, 42)).isEqualTo("text must be of type CharSequence");
        }

        @Test
        @DisplayName("matchesPattern 从开头匹配")
        void testMatchesPattern() {
            Guard guard = CommonGuards.matchesPattern("[a-z]+", "code");
            assertThat(check(guard, "abc")).isNull();
            assertThat(check(guard, "abc123")).isNull();
            assertThat(check(guard, "123abc")).isEqualTo("code must match pattern [a-z]+");
            assertThat(check(guard)).isEqualTo("code must match pattern [a-z]+");
        }

        @Test
        @DisplayName("validEnum 接受实例和常量名")
        void testValidEnum() {
            Guard guard = CommonGuards.validEnum(Color.class, "color");
            assertThat(check(guard, Color.RED)).isNull();
            assertThat(check(guard, "GREEN")).isNull();
            assertThat(check(guard, "BLUE")).isEqualTo("color must be one of [RED, GREEN]: got BLUE");
            assertThat(check(guard, 1)).isEqualTo("color must be a valid Color value");
            assertThat(check(guard)).isEqualTo("color is required");
        }
    }

    @Nested
    @DisplayName("文件与 URL")
    class FilesAndUrls {

        @TempDir
        Path tempDir;

        @Test
        @DisplayName("validFilePath 检查存在性和类型")
        void testValidFilePath() throws Exception {
            Path file = Files.createFile(tempDir.resolve("config.txt"));
            Path missing = tempDir.resolve("missing.txt");

            assertThat(check(CommonGuards.validFilePath("path"), file.toString())).isNull();
            assertThat(check(CommonGuards.validFilePath("path"), missing.toString()))
                    .isEqualTo("path does not exist: " + missing);
            assertThat(check(CommonGuards.validFilePath("path", 0, true, true, false), tempDir.toString()))
                    .isEqualTo("path must be a file: " + tempDir);
            assertThat(check(CommonGuards.validFilePath("path", 0, true, false, true), file))
                    .isEqualTo("path must be a directory: " + file);
            assertThat(check(CommonGuards.validFilePath("path", 0, false, false, false), missing.toString()))
                    .isNull();
            assertThat(check(CommonGuards.validFilePath("path"))).isEqualTo("path is required");
        }

        @Test
        @DisplayName("validUrl 默认要求 scheme")
        void testValidUrl() {
            Guard guard = CommonGuards.validUrl("url");
            assertThat(check(guard, "https://example.com/a")).isNull();
            assertThat(check(guard, "mailto:someone@example.com")).isNull();
            assertThat(check(guard, "example.com")).isEqualTo("url must include a scheme (http/https): example.com");
            assertThat(check(guard, "http://")).isEqualTo("url is not a valid URL: http://");
            assertThat(check(guard)).isEqualTo("url is required");
        }

        @Test
        @DisplayName("validUrl 可不要求 scheme")
        void testValidUrlWithoutScheme() {
            Guard guard = CommonGuards.validUrl("url", 0, false);
            assertThat(check(guard, "example.com/path")).isNull();
            assertThat(check(guard, "")).isEqualTo("url is not a valid URL: ");
        }
    }

    @Test
    @DisplayName("缺少必需参数时构造失败")
    void testInvalidConstruction() {
        assertThatThrownBy(() -> CommonGuards.inRange(null, 1, "x")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> CommonGuards.typeCheck(null, "x")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> CommonGuards.matchesPattern(null, "x")).isInstanceOf(IllegalArgumentException.class);
    }
}
