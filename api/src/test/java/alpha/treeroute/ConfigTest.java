package alpha.treeroute;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Small tests for {@link Config}.
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
final class ConfigTest
{
    @Test
    void defaults() {
        assertThat(Config.DEFAULT.maxPathSegments()).isEqualTo(64);
        assertThat(Config.DEFAULT.maxPathRewrites()).isEqualTo(10);
        assertThat(Config.DEFAULT.traceResolution()).isTrue();
    }
    
    @Test
    void toBuilder_roundTrip() {
        var c = Config.DEFAULT.toBuilder()
                .maxPathSegments(3)
                .traceResolution(false)
                .build();
        assertThat(c.maxPathSegments()).isEqualTo(3);
        assertThat(c.traceResolution()).isFalse();
        
        var d = c.toBuilder().maxPathSegments(5).build();
        assertThat(d.maxPathSegments()).isEqualTo(5);
        // Inherited from c
        assertThat(d.traceResolution()).isFalse();
    }
    
    @Test
    void builder_isImmutable() {
        var base = Config.DEFAULT.toBuilder().maxPathSegments(10);
        var a = base.traceResolution(false).build();
        var b = base.build();
        assertThat(a.traceResolution()).isFalse();
        assertThat(b.traceResolution()).isTrue();
        assertThat(b.maxPathSegments()).isEqualTo(10);
        // And the root is untouched
        assertThat(Config.DEFAULT.maxPathSegments()).isEqualTo(64);
    }
    
    @Test
    void maxPathSegments_negative() {
        assertThatThrownBy(() -> Config.DEFAULT.toBuilder().maxPathSegments(-1))
                .isExactlyInstanceOf(IllegalArgumentException.class)
                .hasMessage("Max path segments is negative: -1");
    }
    
    @Test
    void maxPathRewrites() {
        var c = Config.DEFAULT.toBuilder().maxPathRewrites(0).build();
        assertThat(c.maxPathRewrites()).isZero();
        assertThatThrownBy(() -> c.toBuilder().maxPathRewrites(-2))
                .isExactlyInstanceOf(IllegalArgumentException.class)
                .hasMessage("Max path rewrites is negative: -2");
    }
}
