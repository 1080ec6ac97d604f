package alpha.treeroute;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Small tests for {@link NotFoundException}.
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
final class NotFoundExceptionTest
{
    @Test
    void message_isPathOnly() {
        var e = new NotFoundException(List.of("forum", "abc"), List.of("secret reason"));
        assertThat(e).hasMessage("/forum/abc");
        assertThat(e.getPath()).isEqualTo("/forum/abc");
        assertThat(e.getSegments()).containsExactly("forum", "abc");
        assertThat(e.trace()).containsExactly("secret reason");
    }
    
    @Test
    void root() {
        var e = new NotFoundException(List.of());
        assertThat(e).hasMessage("/");
        assertThat(e.trace()).isEmpty();
    }
}
