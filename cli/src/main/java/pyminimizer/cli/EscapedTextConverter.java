package pyminimizer.cli;

import picocli.CommandLine.ITypeConverter;

/**
 * Lets whitespace be typed on a command line: {@code \t} tab, {@code \s} space,
 * {@code \f} form feed, {@code \\} backslash.
 */
final class EscapedTextConverter implements ITypeConverter<String> {

    @Override
    public String convert(String value) {
        var result = new StringBuilder(value.length());
        for (var i = 0; i < value.length(); i++) {
            var c = value.charAt(i);
            if (c != '\\' || i + 1 == value.length()) {
                result.append(c);
                continue;
            }
            var next = value.charAt(++i);
            switch (next) {
            case 't':
                result.append('\t');
                break;
            case 's':
                result.append(' ');
                break;
            case 'f':
                result.append('\f');
                break;
            case '\\':
                result.append('\\');
                break;
            default:
                result.append(c).append(next);
                break;
            }
        }
        return result.toString();
    }
}
