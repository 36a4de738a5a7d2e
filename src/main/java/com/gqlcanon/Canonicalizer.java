package com.gqlcanon;

import com.gqlcanon.ast.Node;
import com.gqlcanon.passes.AliasStripper;
import com.gqlcanon.passes.ArgumentPruner;
import com.gqlcanon.passes.DefaultValueExtractor;
import com.gqlcanon.passes.DefaultValues;
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
import com.gqlcanon.schema.InputTypeOracle;
import com.gqlcanon.schema.Schema;
import com.gqlcanon.schema.TypeInfo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.Map;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Entry points for the canonicalization passes, one per pass plus the usual combinations.
 * <p>
 * {@link #canonicalize(Node.Document)} inlines fragments, drops the operation name, merges
 * duplicate fields, prunes repeated arguments and sorts, in that order. Two queries asking for
 * the same data come out equal. {@link #parameterize} additionally moves every literal out of
 * the document, so queries that differ only by their values share one canonical shape.
 */
public final class Canonicalizer {
    private static final Logger LOG = LoggerFactory.getLogger(Canonicalizer.class);

    public static final DocumentPass CANONICAL = new FragmentInliner()
            .andThen(new OperationNameStripper())
            .andThen(new Factorizer())
            .andThen(new ArgumentPruner())
            .andThen(new Sorter());

    private Canonicalizer() {
    }

    public static Node.Document canonicalize(Node.Document document) {
        return run("canonicalize", CANONICAL, document);
    }

    public static ExtractedValues parameterize(Node.Document document) {
        return parameterize(document, Set.of(), Map.of());
    }

    public static ExtractedValues parameterize(Node.Document document, Collection<String> ignoredArguments,
                                               Map<String, ?> variables) {
        Node.Document canonical = canonicalize(document);
        LOG.debug("Running remove-values");
        return new ValueExtractor(ignoredArguments, variables).extract(canonical);
    }

    public static Node.Document factorize(Node.Document document) {
        return run("factorize", new Factorizer(), document);
    }

    public static Node.Document sort(Node.Document document) {
        return run("sort", new Sorter(), document);
    }

    public static Node.Document pruneQueryArguments(Node.Document document) {
        return run("prune-arguments", new ArgumentPruner(), document);
    }

    public static Node.Document substituteFragments(Node.Document document) {
        return run("substitute-fragments", new FragmentInliner(), document);
    }

    public static Node.Document removeUnknownArguments(Node.Document document, Schema schema) {
        return run("remove-unknown-arguments", new UnknownArgumentFilter(schema), document);
    }

    public static ExtractedValues removeValues(Node.Document document) {
        return removeValues(document, Set.of(), Map.of());
    }

    public static ExtractedValues removeValues(Node.Document document, Collection<String> ignoredArguments,
                                               Map<String, ?> existingVariables) {
        LOG.debug("Running remove-values");
        return new ValueExtractor(ignoredArguments, existingVariables).extract(document);
    }

    public static ExtractedValues removeValues(Node.Document document, Collection<String> ignoredArguments,
                                               String existingVariablesJson) {
        LOG.debug("Running remove-values");
        return new ValueExtractor(ignoredArguments, existingVariablesJson).extract(document);
    }

    public static Stream<Node.Document> extractRootQueries(Node.Document document) {
        return extractRootQueries(document, true);
    }

    public static Stream<Node.Document> extractRootQueries(Node.Document document, boolean removeAliases) {
        LOG.debug("Running extract-root-queries");
        return new RootQuerySplitter(removeAliases).split(document);
    }

    public static Node.Document removeAliases(Node.Document document) {
        return run("remove-aliases", new AliasStripper(), document);
    }

    public static Node.Document insertVariables(Node.Document document, Map<String, ?> variables) {
        return run("insert-variables", new ValueInserter(variables), document);
    }

    public static Node.Document insertVariables(Node.Document document, String variablesJson) {
        return run("insert-variables", new ValueInserter(variablesJson), document);
    }

    public static Node.Document insertVariables(Node.Document document, Map<String, ?> variables, Schema schema) {
        return run("insert-variables", new ValueInserter(variables, new TypeInfo(schema)), document);
    }

    public static Node.Document buildVariableDefinitions(Node.Document document, Schema schema) {
        return buildVariableDefinitions(document, new TypeInfo(schema));
    }

    public static Node.Document buildVariableDefinitions(Node.Document document, InputTypeOracle oracle) {
        return run("build-variable-definitions", new VariableDefinitionBuilder(oracle), document);
    }

    public static Node.Document removeQueryName(Node.Document document) {
        return run("remove-query-name", new OperationNameStripper(), document);
    }

    public static DefaultValues removeDefaultValues(Node.Document document) {
        LOG.debug("Running remove-default-values");
        return new DefaultValueExtractor().extract(document);
    }

    private static Node.Document run(String name, DocumentPass pass, Node.Document document) {
        LOG.debug("Running {}", name);
        return pass.apply(document);
    }
}
