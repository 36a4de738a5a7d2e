package com.gqlcanon;

import com.gqlcanon.ast.Node;
import com.gqlcanon.json.VariablesParser;
import com.gqlcanon.output.AstPrinter;
import com.gqlcanon.output.ValuesWriter;
import com.gqlcanon.parser.DocumentParser;
import com.gqlcanon.parser.SchemaParser;
import com.gqlcanon.passes.AliasStripper;
import com.gqlcanon.passes.ArgumentPruner;
import com.gqlcanon.passes.DefaultValueExtractor;
import com.gqlcanon.passes.DocumentPass;
import com.gqlcanon.passes.ExtractedValues;
import com.gqlcanon.passes.Factorizer;
import com.gqlcanon.passes.FragmentInliner;
import com.gqlcanon.passes.OperationNameStripper;
import com.gqlcanon.passes.RootQuerySplitter;
import com.gqlcanon.passes.Sorter;
import com.gqlcanon.passes.UnknownArgumentFilter;
import com.gqlcanon.passes.ValueExtractor;
import com.gqlcanon.passes.ValueInserter;
import com.gqlcanon.passes.VariableDefinitionBuilder;
import com.gqlcanon.schema.Schema;
import com.gqlcanon.schema.TypeInfo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.function.Function;

@Command(name = "gqlcanon", mixinStandardHelpOptions = true, version = "1.0",
         description = "Rewrite GraphQL query documents into a canonical form")
public class GqlCanon implements Callable<Integer> {
    private static final Logger LOG = LoggerFactory.getLogger(GqlCanon.class);

    @Spec
    private CommandSpec spec;

    @Parameters(index = "0", arity = "0..1", description = "Input query document (default: stdin)")
    private File inputFile;

    @Option(names = "--passes", split = ",", paramLabel = "PASS", converter = PassNameConverter.class,
            description = "Comma-separated passes to run in order (default: the canonical pipeline). "
                    + "Known passes: substitute-fragments, remove-query-name, factorize, prune-arguments, sort, "
                    + "remove-aliases, remove-default-values, remove-unknown-arguments, build-variable-definitions")
    private List<PassName> passes;

    @Option(names = {"-s", "--schema"}, paramLabel = "FILE", description = "Schema definition (SDL) file")
    private File schemaFile;

    @Option(names = {"-x", "--extract-values"}, description = "Replace values with placeholders and print them as JSON")
    private boolean extractValues = false;

    @Option(names = {"-i", "--ignore-argument"}, paramLabel = "NAME",
            description = "Argument or input field whose value is left in place by --extract-values")
    private List<String> ignoredArguments = new ArrayList<>();

    @Option(names = "--variables", paramLabel = "FILE", description = "JSON object holding the query variables")
    private File variablesFile;

    @Option(names = "--insert-variables", description = "Substitute the --variables values before running the passes")
    private boolean insertVariables = false;

    @Option(names = "--split-root", description = "Print one document per root field of the query")
    private boolean splitRoot = false;

    @Option(names = "--keep-root-aliases", description = "Keep root field aliases when splitting")
    private boolean keepRootAliases = false;

    /** Passes selectable from the command line. */
    enum PassName {
        SUBSTITUTE_FRAGMENTS(schema -> new FragmentInliner()),
        REMOVE_QUERY_NAME(schema -> new OperationNameStripper()),
        FACTORIZE(schema -> new Factorizer()),
        PRUNE_ARGUMENTS(schema -> new ArgumentPruner()),
        SORT(schema -> new Sorter()),
        REMOVE_ALIASES(schema -> new AliasStripper()),
        REMOVE_DEFAULT_VALUES(schema -> new DefaultValueExtractor()),
        REMOVE_UNKNOWN_ARGUMENTS(schema -> new UnknownArgumentFilter(schema)),
        BUILD_VARIABLE_DEFINITIONS(schema -> new VariableDefinitionBuilder(new TypeInfo(schema)));

        private final Function<Schema, DocumentPass> factory;

        PassName(Function<Schema, DocumentPass> factory) {
            this.factory = factory;
        }

        String cliName() {
            return name().toLowerCase(Locale.ROOT).replace('_', '-');
        }

        boolean needsSchema() {
            return this == REMOVE_UNKNOWN_ARGUMENTS || this == BUILD_VARIABLE_DEFINITIONS;
        }

        DocumentPass create(Schema schema) {
            if (needsSchema() && schema == null) {
                throw new IllegalArgumentException("Pass " + cliName() + " requires --schema");
            }
            return factory.apply(schema);
        }
    }

    /** Accepts pass names as printed by {@link PassName#cliName()}, in any case. */
    public static class PassNameConverter implements CommandLine.ITypeConverter<PassName> {
        @Override
        public PassName convert(String value) {
            String constant = value.trim().toUpperCase(Locale.ROOT).replace('-', '_');
            try {
                return PassName.valueOf(constant);
            } catch (IllegalArgumentException e) {
                throw new CommandLine.TypeConversionException("Unknown pass '" + value + "'");
            }
        }
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new GqlCanon()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() {
        try {
            Node.Document document = DocumentParser.parse(readInput());
            Schema schema = schemaFile == null ? null : SchemaParser.parse(Files.readString(schemaFile.toPath()));
            Map<String, Object> variables = readVariables();

            if (insertVariables) {
                document = new ValueInserter(variables, schema == null ? null : new TypeInfo(schema)).apply(document);
            }
            document = pipeline(schema).apply(document);

            List<Node.Document> outputs = splitRoot
                    ? new RootQuerySplitter(!keepRootAliases).split(document).toList()
                    : List.of(document);

            PrintWriter out = spec.commandLine().getOut();
            ValuesWriter valuesWriter = new ValuesWriter();
            for (int i = 0; i < outputs.size(); i++) {
                if (i > 0) {
                    out.println();
                }
                if (extractValues) {
                    ExtractedValues extracted = new ValueExtractor(ignoredArguments, variables).extract(outputs.get(i));
                    out.println(AstPrinter.print(extracted.document()));
                    out.println(valuesWriter.write(extracted.values()));
                } else {
                    out.println(AstPrinter.print(outputs.get(i)));
                }
            }
            out.flush();
            return 0;
        } catch (Exception e) {
            LOG.error("Canonicalization failed", e);
            spec.commandLine().getErr().println("Error: " + e.getMessage());
            return 1;
        }
    }

    private DocumentPass pipeline(Schema schema) {
        if (passes == null || passes.isEmpty()) {
            return Canonicalizer.CANONICAL;
        }
        DocumentPass pipeline = document -> document;
        for (PassName pass : passes) {
            LOG.debug("Adding pass {}", pass.cliName());
            pipeline = pipeline.andThen(pass.create(schema));
        }
        return pipeline;
    }

    private String readInput() throws IOException {
        if (inputFile == null) {
            return new String(System.in.readAllBytes(), StandardCharsets.UTF_8);
        }
        return Files.readString(inputFile.toPath());
    }

    private Map<String, Object> readVariables() throws IOException {
        if (variablesFile == null) {
            return Map.of();
        }
        try (InputStream input = new FileInputStream(variablesFile)) {
            return new VariablesParser().parse(input);
        }
    }
}
