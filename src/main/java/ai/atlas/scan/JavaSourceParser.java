package ai.atlas.scan;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import com.github.javaparser.JavaParser;
import com.github.javaparser.ParserConfiguration;
import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.ImportDeclaration;
import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.body.CallableDeclaration;
import com.github.javaparser.ast.body.TypeDeclaration;
import com.github.javaparser.ast.expr.MethodCallExpr;

/**
 * Java branch of the structural parser, backed by JavaParser.
 * Imports are emitted as paths relative to the importing file's package
 * directory: from package {@code com.acme}, {@code com.other.Util} becomes
 * {@code ../other/Util.java} and {@code com.acme.util.*} becomes
 * {@code ./util}. Without a package declaration they stay rooted
 * ({@code com/other/Util.java}).
 */
final class JavaSourceParser {

    // JavaParser instances are not thread-safe
    private static final ThreadLocal<JavaParser> PARSER = ThreadLocal.withInitial(() ->
            new JavaParser(new ParserConfiguration()
                    .setLanguageLevel(ParserConfiguration.LanguageLevel.JAVA_17)));

    ParseResult parse(Path file, boolean detailed) {
        final String language = SourceLanguage.JAVA.id();
        try {
            final SourceText source = SourceText.read(file);
            final var res = PARSER.get().parse(source.text());
            final var cuOpt = res.getResult();
            if (cuOpt.isEmpty()) {
                final String msg = res.getProblems().isEmpty()
                        ? "unparseable"
                        : res.getProblems().get(0).getMessage();
                return ParseResult.failure(file.toString(), language, msg);
            }
            final CompilationUnit cu = cuOpt.get();

            final List<String> pkg = cu.getPackageDeclaration()
                    .map(p -> List.of(p.getNameAsString().split("\\.")))
                    .orElse(List.of());
            final List<String> imports = new ArrayList<>();
            for (ImportDeclaration imp : cu.getImports()) {
                imports.add(importToken(imp, pkg));
            }

            final List<Definition> definitions = new ArrayList<>();
            if (detailed) {
                for (TypeDeclaration<?> td : cu.findAll(TypeDeclaration.class)) {
                    definitions.add(toDefinition(source, td, td.getNameAsString(), Definition.CLASS, null));
                }
                for (CallableDeclaration<?> cd : cu.findAll(CallableDeclaration.class)) {
                    definitions.add(toDefinition(source, cd, cd.getNameAsString(), Definition.FUNCTION,
                            cd.getDeclarationAsString(true, true, true)));
                }
                definitions.sort((a, b) -> Integer.compare(a.startByte(), b.startByte()));
            }
            return new ParseResult(file.toString(), language, imports, definitions, null);
        } catch (Exception ex) {
            return ParseResult.failure(file.toString(), language,
                    ex.getClass().getSimpleName() + ": " + ex.getMessage());
        }
    }

    static String importToken(ImportDeclaration imp, List<String> pkg) {
        String name = imp.getNameAsString();
        String suffix = ".java";
        if (imp.isAsterisk()) {
            // package (or, for static imports, the owning class)
            suffix = imp.isStatic() ? ".java" : "";
        } else if (imp.isStatic()) {
            final int i = name.lastIndexOf('.');
            name = i > 0 ? name.substring(0, i) : name;
        }
        return relativeTo(pkg, List.of(name.split("\\."))) + suffix;
    }

    /** Path of {@code target} seen from the directory of package {@code pkg}. */
    static String relativeTo(List<String> pkg, List<String> target) {
        if (pkg.isEmpty()) {
            return String.join("/", target);
        }
        int common = 0;
        while (common < pkg.size() && common < target.size() - 1 && pkg.get(common).equals(target.get(common))) {
            common++;
        }
        final String rest = String.join("/", target.subList(common, target.size()));
        final int up = pkg.size() - common;
        return up == 0 ? "./" + rest : "../".repeat(up) + rest;
    }

    private static Definition toDefinition(SourceText source, Node node, String name, String kind, String signature) {
        int start = 0;
        int end = 0;
        if (node.getBegin().isPresent() && node.getEnd().isPresent()) {
            start = source.offset(node.getBegin().get().line, node.getBegin().get().column);
            end = Math.min(source.text().length(), source.offset(node.getEnd().get().line, node.getEnd().get().column) + 1);
        }
        final String content = end > start ? source.text().substring(start, end) : node.toString();

        final Set<String> calls = new LinkedHashSet<>();
        for (MethodCallExpr call : node.findAll(MethodCallExpr.class)) {
            calls.add(call.getNameAsString());
        }
        return new Definition(name, kind, source.byteOffset(start), source.byteOffset(end),
                signature != null ? signature : header(content), content, new ArrayList<>(calls));
    }

    /** Declaration text up to the body brace, annotation lines dropped. */
    private static String header(String content) {
        final int brace = content.indexOf('{');
        final String head = brace >= 0 ? content.substring(0, brace) : content;
        final StringBuilder sb = new StringBuilder();
        for (String line : head.split("\\R")) {
            final String t = line.trim();
            if (t.isEmpty() || t.startsWith("@")) {
                continue;
            }
            if (sb.length() > 0) {
                sb.append(' ');
            }
            sb.append(t);
        }
        return sb.length() > 0 ? sb.toString() : head.trim();
    }
}
