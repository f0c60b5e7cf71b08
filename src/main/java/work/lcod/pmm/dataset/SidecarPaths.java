package work.lcod.pmm.dataset;

import java.nio.file.Path;

/**
 * Naming convention pairing a table file with its sidecar.
 *
 * <p>{@code data.csv} pairs with {@code data.pmm}; an extension extending the table extension keeps its
 * remainder ({@code data.csv2} pairs with {@code data.pmm2}). The dataset name is the file name without
 * its extension.
 */
public final class SidecarPaths {
    public static final String SIDECAR_EXTENSION = ".pmm";

    private SidecarPaths() {}

    public static SidecarLocation locate(Path tablePath, String tableExtension) {
        String fileName = tablePath.getFileName() == null ? "" : tablePath.getFileName().toString();
        int dot = extensionStart(fileName);
        String body = dot < 0 ? fileName : fileName.substring(0, dot);
        String extension = dot < 0 ? "" : fileName.substring(dot);
        String sidecarName = extension.startsWith(tableExtension)
            ? body + SIDECAR_EXTENSION + extension.substring(tableExtension.length())
            : body + SIDECAR_EXTENSION;
        return new SidecarLocation(tablePath.resolveSibling(sidecarName), body);
    }

    private static int extensionStart(String fileName) {
        int dot = fileName.lastIndexOf('.');
        int leading = 0;
        while (leading < fileName.length() && fileName.charAt(leading) == '.') {
            leading++;
        }
        return dot < leading ? -1 : dot;
    }

    public record SidecarLocation(Path sidecar, String datasetName) {}
}
