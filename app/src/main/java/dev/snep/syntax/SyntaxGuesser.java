package dev.snep.syntax;

import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Suggests directive syntaxes for a file from its extension and shebang line.
 */
public class SyntaxGuesser {

    private static final Set<String> C_EXTENSIONS = Set.of(
            "c", "cc", "cpp", "cxx", "c++", "C",
            "h", "hh", "hpp", "hxx", "h++", "H");
    private static final Set<String> HASKELL_EXTENSIONS = Set.of("hs", "hsc");
    private static final Pattern SHELL_EXTENSION = Pattern.compile("^(py|\\w*sh)$");
    private static final Pattern SHELL_SHEBANG = Pattern.compile("[/ ]\\w*sh\\s");
    private static final Pattern PYTHON_SHEBANG = Pattern.compile("[/ ]i?python[.\\d]*\\s");

    /**
     * @param extension file extension without the leading dot, may be empty
     * @param shebang first line of the file, may be empty
     * @return candidate syntaxes, most likely first; empty when nothing matches
     */
    public List<DirectiveSyntax> guess(String extension, String shebang) {
        String ext = extension == null ? "" : extension;
        String firstLine = shebang == null ? "" : shebang;

        if (C_EXTENSIONS.contains(ext)) {
            return List.of(DirectiveSyntax.C, DirectiveSyntax.CPP);
        }
        if (HASKELL_EXTENSIONS.contains(ext)) {
            return List.of(DirectiveSyntax.HS, DirectiveSyntax.HS_BLOCK);
        }
        if (SHELL_EXTENSION.matcher(ext).find()) {
            return List.of(DirectiveSyntax.SH);
        }
        if (firstLine.startsWith("#!")) {
            String padded = firstLine.endsWith("\n") ? firstLine : firstLine + "\n";
            if (SHELL_SHEBANG.matcher(padded).find() || PYTHON_SHEBANG.matcher(padded).find()) {
                return List.of(DirectiveSyntax.SH);
            }
        }
        return List.of();
    }

    public static String extensionOf(String fileName) {
        if (fileName == null) {
            return "";
        }
        int slash = Math.max(fileName.lastIndexOf('/'), fileName.lastIndexOf('\\'));
        String baseName = fileName.substring(slash + 1);
        int dot = baseName.lastIndexOf('.');
        return dot <= 0 ? "" : baseName.substring(dot + 1);
    }
}
