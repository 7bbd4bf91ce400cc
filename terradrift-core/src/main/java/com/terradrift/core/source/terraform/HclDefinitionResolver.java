package com.terradrift.core.source.terraform;

import com.terradrift.core.compare.PathResolver;
import com.terradrift.core.error.DefinitionParseException;
import com.terradrift.core.error.ResourceNotFoundException;
import com.terradrift.core.model.ConfigValue;
import com.terradrift.core.model.ConfigValue.ListValue;
import com.terradrift.core.model.ConfigValue.MapValue;
import com.terradrift.core.parser.HclLexer;
import com.terradrift.core.parser.HclParser;
import com.terradrift.core.source.DeclarativeConfigResolver;
import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.CharStream;
import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Recognizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Resolves declared configuration from Terraform {@code .tf} files.
 *
 * <p>The source is a single {@code .tf} file or a directory walked recursively for them
 * ({@code .terraform} directories are skipped). A {@code resource "<type>" "<name>"} block
 * matches when its match attribute (by default {@code tags.Name}) equals the resource
 * identifier. The first match in path order wins.
 *
 * <p>A block body becomes a map:
 * <ul>
 *   <li>attributes with literal values are kept; other expressions are skipped and logged at debug</li>
 *   <li>nested blocks become a list of maps under the block type, in the order written</li>
 *   <li>the meta-arguments {@code count}, {@code for_each}, {@code depends_on}, {@code provider}
 *       and the blocks {@code lifecycle}, {@code provisioner}, {@code connection}, {@code dynamic}
 *       are left out</li>
 * </ul>
 *
 * <p>Files are parsed once, on first use.
 */
public class HclDefinitionResolver implements DeclarativeConfigResolver {

    private static final Logger log = LoggerFactory.getLogger(HclDefinitionResolver.class);

    private static final String TF_EXTENSION = ".tf";
    private static final String BYTE_ORDER_MARK = "\uFEFF";
    private static final String TERRAFORM_WORK_DIR = ".terraform";
    private static final String RESOURCE_BLOCK = "resource";
    private static final Set<String> META_ARGUMENTS = Set.of("count", "for_each", "depends_on", "provider");
    private static final Set<String> META_BLOCKS = Set.of("lifecycle", "provisioner", "connection", "dynamic");

    private final Path definitionPath;
    private final TerraformLookup lookup;

    private List<ResourceBlock> resources;

    public HclDefinitionResolver(Path definitionPath, TerraformLookup lookup) {
        this.definitionPath = Objects.requireNonNull(definitionPath, "definitionPath must not be null");
        this.lookup = Objects.requireNonNull(lookup, "lookup must not be null");
    }

    @Override
    public ConfigValue resolve(String resourceId) {
        for (ResourceBlock resource : resources()) {
            Optional<ConfigValue> matchValue = PathResolver.resolve(resource.body(), lookup.definitionMatchAttribute());
            if (matchValue.isPresent()
                && matchValue.get() instanceof ConfigValue.StringValue text
                && text.value().equals(resourceId)) {
                log.debug("Resolved {} {} from {}.{} in {}",
                    lookup.resourceType(), resourceId, resource.type(), resource.name(), resource.file());
                return resource.body();
            }
        }
        throw new ResourceNotFoundException(lookup.resourceType(), resourceId, describe());
    }

    @Override
    public String describe() {
        return "Terraform definitions " + definitionPath;
    }

    private synchronized List<ResourceBlock> resources() {
        if (resources == null) {
            List<ResourceBlock> found = new ArrayList<>();
            for (Path file : findDefinitionFiles()) {
                found.addAll(parseFile(file));
            }
            resources = List.copyOf(found);
            log.debug("Found {} {} blocks under {}", resources.size(), lookup.resourceType(), definitionPath);
        }
        return resources;
    }

    private List<Path> findDefinitionFiles() {
        if (Files.isRegularFile(definitionPath)) {
            if (!definitionPath.getFileName().toString().endsWith(TF_EXTENSION)) {
                throw new DefinitionParseException(definitionPath,
                    "Not a Terraform definition file (expected " + TF_EXTENSION + "): " + definitionPath);
            }
            return List.of(definitionPath);
        }
        if (!Files.isDirectory(definitionPath)) {
            throw new DefinitionParseException(definitionPath, "Definition path not found: " + definitionPath);
        }

        List<Path> files;
        try (Stream<Path> paths = Files.walk(definitionPath)) {
            files = paths
                .filter(Files::isRegularFile)
                .filter(path -> path.getFileName().toString().endsWith(TF_EXTENSION))
                .filter(path -> !isInsideWorkDir(path))
                .sorted()
                .collect(Collectors.toList());
        } catch (IOException e) {
            throw new DefinitionParseException(definitionPath,
                "Failed to list definition files under " + definitionPath + ": " + e.getMessage(), e);
        }

        if (files.isEmpty()) {
            throw new DefinitionParseException(definitionPath, "No " + TF_EXTENSION + " files found under " + definitionPath);
        }
        return files;
    }

    private boolean isInsideWorkDir(Path path) {
        for (Path segment : definitionPath.relativize(path)) {
            if (segment.toString().equals(TERRAFORM_WORK_DIR)) {
                return true;
            }
        }
        return false;
    }

    private List<ResourceBlock> parseFile(Path file) {
        String content;
        try {
            content = Files.readString(file);
        } catch (IOException e) {
            throw new DefinitionParseException(file, "Failed to read " + file + ": " + e.getMessage(), e);
        }
        return parseContent(file, content);
    }

    /**
     * Parses one file's content and returns its resource blocks of the configured type.
     *
     * @param file file the content came from, used in messages
     * @param content HCL source
     * @return matching resource blocks in source order
     * @throws DefinitionParseException on any syntax error
     */
    List<ResourceBlock> parseContent(Path file, String content) {
        if (content.startsWith(BYTE_ORDER_MARK)) {
            content = content.substring(BYTE_ORDER_MARK.length());
        }
        CharStream input = CharStreams.fromString(content, file.toString());
        HclLexer lexer = new HclLexer(input);
        CommonTokenStream tokens = new CommonTokenStream(lexer);
        HclParser parser = new HclParser(tokens);

        SyntaxErrorCollector errors = new SyntaxErrorCollector();
        lexer.removeErrorListeners();
        parser.removeErrorListeners();
        lexer.addErrorListener(errors);
        parser.addErrorListener(errors);

        HclParser.ConfigFileContext tree = parser.configFile();
        if (!errors.messages.isEmpty()) {
            throw new DefinitionParseException(file,
                "Syntax error in " + file + ": " + String.join("; ", errors.messages));
        }

        List<ResourceBlock> found = new ArrayList<>();
        for (HclParser.BodyItemContext item : tree.body().bodyItem()) {
            HclParser.BlockContext block = item.block();
            if (block == null || !RESOURCE_BLOCK.equals(block.name().getText())) {
                continue;
            }
            List<String> labels = block.blockLabel().stream().map(HclDefinitionResolver::labelText).toList();
            if (labels.size() != 2) {
                log.warn("Skipping resource block with {} labels at {}:{}", labels.size(), file, block.getStart().getLine());
                continue;
            }
            if (lookup.resourceType().equals(labels.get(0))) {
                found.add(new ResourceBlock(labels.get(0), labels.get(1), file, convertBody(file, block.body())));
            }
        }
        return found;
    }

    private MapValue convertBody(Path file, HclParser.BodyContext body) {
        Map<String, ConfigValue> entries = new LinkedHashMap<>();
        Map<String, List<ConfigValue>> nestedBlocks = new LinkedHashMap<>();

        for (HclParser.BodyItemContext item : body.bodyItem()) {
            if (item.attribute() != null) {
                HclParser.AttributeContext attribute = item.attribute();
                String name = attribute.name().getText();
                if (META_ARGUMENTS.contains(name)) {
                    continue;
                }
                Optional<ConfigValue> value = HclValueEvaluator.INSTANCE.visit(attribute.expression());
                if (value.isPresent()) {
                    entries.put(name, value.get());
                } else {
                    log.debug("Skipping non-literal attribute {} at {}:{}", name, file, attribute.getStart().getLine());
                }
            } else {
                HclParser.BlockContext block = item.block();
                String type = block.name().getText();
                if (META_BLOCKS.contains(type)) {
                    continue;
                }
                nestedBlocks.computeIfAbsent(type, key -> new ArrayList<>()).add(convertBody(file, block.body()));
            }
        }

        nestedBlocks.forEach((type, blocks) -> entries.putIfAbsent(type, new ListValue(blocks)));
        return new MapValue(entries);
    }

    private static String labelText(HclParser.BlockLabelContext label) {
        if (label.STRING() != null) {
            return HclValueEvaluator.stringLiteral(label.STRING()).orElse(label.STRING().getText());
        }
        return label.name().getText();
    }

    /**
     * One parsed {@code resource} block.
     *
     * @param type resource type label
     * @param name resource name label
     * @param file source file
     * @param body evaluated block body
     */
    record ResourceBlock(String type, String name, Path file, MapValue body) {}

    private static final class SyntaxErrorCollector extends BaseErrorListener {

        private final List<String> messages = new ArrayList<>();

        @Override
        public void syntaxError(Recognizer<?, ?> recognizer, Object offendingSymbol,
                                int line, int charPositionInLine, String msg, RecognitionException e) {
            messages.add("line " + line + ":" + charPositionInLine + " " + msg);
        }
    }
}
