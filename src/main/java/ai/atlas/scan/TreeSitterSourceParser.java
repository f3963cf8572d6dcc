package ai.atlas.scan;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.treesitter.TSLanguage;
import org.treesitter.TSNode;
import org.treesitter.TSParser;
import org.treesitter.TSTree;
import org.treesitter.TreeSitterC;
import org.treesitter.TreeSitterCpp;
import org.treesitter.TreeSitterJavascript;
import org.treesitter.TreeSitterTypescript;

/**
 * Grammar-backed branch of the structural parser. Comments and string
 * literals are tree nodes of their own, so nothing inside them is ever taken
 * for an import, a definition or a call.
 */
final class TreeSitterSourceParser {

    private static final Logger log = LoggerFactory.getLogger(TreeSitterSourceParser.class);

    private static final Map<SourceLanguage, LanguageSyntax> SYNTAX = new EnumMap<>(SourceLanguage.class);

    static {
        SYNTAX.put(SourceLanguage.C, new CFamilySyntax(TreeSitterC::new));
        SYNTAX.put(SourceLanguage.CPP, new CFamilySyntax(TreeSitterCpp::new));
        SYNTAX.put(SourceLanguage.PYTHON, new PythonSyntax());
        SYNTAX.put(SourceLanguage.JAVASCRIPT, new ScriptSyntax(TreeSitterJavascript::new));
        // .tsx goes through the TypeScript grammar; JSX regions come back as error nodes
        SYNTAX.put(SourceLanguage.TYPESCRIPT, new ScriptSyntax(TreeSitterTypescript::new));
        SYNTAX.put(SourceLanguage.RUST, new RustSyntax());
        SYNTAX.put(SourceLanguage.GO, new GoSyntax());
        SYNTAX.put(SourceLanguage.KOTLIN, new KotlinSyntax());
    }

    private final Map<SourceLanguage, TSLanguage> grammars = new ConcurrentHashMap<>();

    // TSParser instances are not thread-safe
    private final ThreadLocal<TSParser> parsers = ThreadLocal.withInitial(TSParser::new);

    ParseResult parse(Path file, SourceLanguage language, boolean detailed) {
        final LanguageSyntax syntax = SYNTAX.get(language);
        // walked and listed, but no grammar is bundled for it (lua)
        if (syntax == null) {
            return ParseResult.failure(file.toString(), language.id(), "Language " + language.id() + " not supported.");
        }
        try {
            final SourceText source = SourceText.read(file);
            final TSParser parser = parsers.get();
            if (!parser.setLanguage(grammars.computeIfAbsent(language, l -> syntax.grammar()))) {
                return ParseResult.failure(file.toString(), language.id(), "Grammar for " + language.id() + " is incompatible.");
            }
            final TSTree tree = parser.parseString(null, source.text());
            final TSNode root = tree.getRootNode();

            final List<String> imports = new ArrayList<>();
            SyntaxNodes.walk(root, node -> !syntax.collectImports(node, source, imports));
            final List<Definition> definitions = detailed ? definitions(root, syntax, source) : List.of();
            return new ParseResult(file.toString(), language.id(), imports, definitions, null);
        } catch (Exception | LinkageError ex) {
            log.debug("Parse of {} failed", file, ex);
            return ParseResult.failure(file.toString(), language.id(),
                    ex.getClass().getSimpleName() + ": " + ex.getMessage());
        }
    }

    private static List<Definition> definitions(TSNode root, LanguageSyntax syntax, SourceText source) {
        final List<Definition> out = new ArrayList<>();
        SyntaxNodes.walk(root, node -> {
            syntax.definition(node, source).ifPresent(site -> out.add(toDefinition(site, syntax, source)));
            return true;
        });
        out.sort(Comparator.comparingInt(Definition::startByte));
        return out;
    }

    private static Definition toDefinition(LanguageSyntax.Site site, LanguageSyntax syntax, SourceText source) {
        final TSNode span = site.span();
        final int start = span.getStartByte();
        final int end = span.getEndByte();
        final String content = source.slice(start, end);
        return new Definition(site.name(), site.kind(), start, end,
                signature(site, source, content), content, calls(span, syntax, source));
    }

    /** Header text up to the body, on one line; the first line when there is no body. */
    private static String signature(LanguageSyntax.Site site, SourceText source, String content) {
        if (site.body() != null && site.body().getStartByte() > site.span().getStartByte()) {
            return source.slice(site.span().getStartByte(), site.body().getStartByte())
                    .trim().replaceAll("\\s*\\R\\s*", " ");
        }
        final int eol = content.indexOf('\n');
        return (eol < 0 ? content : content.substring(0, eol)).trim();
    }

    /** Distinct called names in source order. */
    private static List<String> calls(TSNode span, LanguageSyntax syntax, SourceText source) {
        final List<TSNode> names = new ArrayList<>();
        SyntaxNodes.walk(span, node -> {
            final TSNode name = syntax.calleeName(node);
            if (name != null) {
                names.add(name);
            }
            return true;
        });
        // a chained call starts where its receiver call starts, so order by the name itself
        names.sort(Comparator.comparingInt(TSNode::getStartByte));
        final Set<String> distinct = new LinkedHashSet<>();
        for (TSNode name : names) {
            final String text = SyntaxNodes.text(name, source).trim();
            if (!text.isEmpty()) {
                distinct.add(text);
            }
        }
        return new ArrayList<>(distinct);
    }
}
