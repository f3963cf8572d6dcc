package ai.atlas.model;

import java.util.Objects;

/**
 * Node identity helpers.
 * - file / directory nodes: project-relative path, '/' separated
 * - definition nodes: {@code <path>::<name>}
 */
public final class Ids {

    public static final String DEFINITION_SEPARATOR = "::";

    public static final String ROOT_GROUP = "Root";

    private Ids() {
    }

    public static String definitionId(String filePath, String name) {
        Objects.requireNonNull(filePath, "filePath");
        Objects.requireNonNull(name, "name");
        return filePath + DEFINITION_SEPARATOR + name;
    }

    public static boolean isDefinitionId(String id) {
        return id != null && id.contains(DEFINITION_SEPARATOR);
    }

    /** Owning file of a definition id, or the id itself for file / directory ids. */
    public static String ownerPath(String id) {
        final int i = id.indexOf(DEFINITION_SEPARATOR);
        return i >= 0 ? id.substring(0, i) : id;
    }

    /** Bare symbol name of a definition id. */
    public static String shortName(String id) {
        final int i = id.lastIndexOf(DEFINITION_SEPARATOR);
        return i >= 0 ? id.substring(i + DEFINITION_SEPARATOR.length()) : id;
    }

    public static String normalizePath(String path) {
        if (path == null) {
            return "";
        }
        String p = path.trim().replace('\\', '/');
        while (p.startsWith("./")) {
            p = p.substring(2);
        }
        while (p.endsWith("/") && p.length() > 1) {
            p = p.substring(0, p.length() - 1);
        }
        return p;
    }

    public static String basename(String path) {
        final String p = normalizePath(path);
        final int i = p.lastIndexOf('/');
        return i >= 0 ? p.substring(i + 1) : p;
    }

    /** Parent directory of a path, "" for top-level entries. */
    public static String parentDir(String path) {
        final String p = normalizePath(path);
        final int i = p.lastIndexOf('/');
        return i >= 0 ? p.substring(0, i) : "";
    }

    public static String stripExtension(String path) {
        final int slash = path.lastIndexOf('/');
        final int dot = path.lastIndexOf('.');
        return dot > slash + 1 ? path.substring(0, dot) : path;
    }

    public static String extension(String path) {
        final String name = basename(path);
        final int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(dot) : "";
    }
}
