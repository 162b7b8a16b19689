package com.modgud.transform;

import com.modgud.ast.SourceLocation;
import com.modgud.transform.error.ExplicitReturnDisallowedException;
import com.modgud.transform.error.UnsupportedConstructException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

@DisplayName("RewriteOptions 测试")
class RewriteOptionsTest {

    @Test
    @DisplayName("默认值")
    void testDefaults() {
        RewriteOptions options = new RewriteOptions();
        assertThat(options.getResultSlot()).isEqualTo("__implicit_result");
        assertThat(options.getMissingElsePolicy()).isEqualTo(BranchPolicy.REJECT);
        assertThat(options.getEmptyBlockPolicy()).isEqualTo(BranchPolicy.SYNTHESIZE_ABSENT);
        assertThat(options.getCacheSize()).isZero();
    }

    @Test
    @DisplayName("非法值被拒绝")
    void testInvalidValues() {
        RewriteOptions options = new RewriteOptions();
        assertThatThrownBy(() -> options.setResultSlot("")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> options.setResultSlot(null)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> options.setCacheSize(-1)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> options.setMissingElsePolicy(null)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> options.setEmptyBlockPolicy(null)).isInstanceOf(IllegalArgumentException.class);
        assertThat(options.getMissingElsePolicy()).isEqualTo(BranchPolicy.REJECT);
        assertThat(options.getEmptyBlockPolicy()).isEqualTo(BranchPolicy.SYNTHESIZE_ABSENT);
    }

    @Test
    @DisplayName("copy 得到独立的配置")
    void testCopy() {
        RewriteOptions options = new RewriteOptions();
        options.setResultSlot("__r");
        options.setCacheSize(8);
        RewriteOptions copy = options.copy();
        options.setResultSlot("__other");

        assertThat(copy.getResultSlot()).isEqualTo("__r");
        assertThat(copy.getCacheSize()).isEqualTo(8);
        assertThat(copy.getMissingElsePolicy()).isEqualTo(BranchPolicy.REJECT);
    }

    @Test
    @DisplayName("异常消息只在位置已知时附带行列号")
    void testExceptionMessageLocation() {
        ExplicitReturnDisallowedException known =
                new ExplicitReturnDisallowedException("Explicit return", SourceLocation.of(3, 9));
        UnsupportedConstructException unknown =
                new UnsupportedConstructException("Unsupported", SourceLocation.UNKNOWN);

        assertThat(known.getMessage()).isEqualTo("Explicit return at line 3, column 9");
        assertThat(known.hasLocation()).isTrue();
        assertThat(unknown.getMessage()).isEqualTo("Unsupported");
        assertThat(unknown.getLocation()).isNull();
    }
}
