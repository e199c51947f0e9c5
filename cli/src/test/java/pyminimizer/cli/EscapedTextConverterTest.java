package pyminimizer.cli;

import static org.junit.jupiter.api.Assertions.assertEquals;

import org.junit.jupiter.api.Test;

public class EscapedTextConverterTest {

    private final EscapedTextConverter converter = new EscapedTextConverter();

    @Test
    void escapes() {
        assertEquals("\t", converter.convert("\\t"));
        assertEquals(" ", converter.convert("\\s"));
        assertEquals("\f", converter.convert("\\f"));
        assertEquals("\\", converter.convert("\\\\"));
        assertEquals("  ", converter.convert("\\s\\s"));
    }

    @Test
    void plainText() {
        assertEquals(" ", converter.convert(" "));
        assertEquals("\\n", converter.convert("\\n"));
        assertEquals("a\\", converter.convert("a\\"));
    }
}
