package com.cstruct.extractor.extract;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import org.antlr.v4.runtime.tree.ParseTree;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.cstruct.extractor.extract.config.ExtractionConfig;
import com.cstruct.extractor.extract.config.InitializerMatching;
import com.cstruct.extractor.extract.config.NestedInitializerMode;
import com.cstruct.extractor.extract.model.AggregateValue;
import com.cstruct.extractor.extract.model.FieldBinding;
import com.cstruct.extractor.extract.model.ScalarValue;
import com.cstruct.extractor.extract.model.SimpleExpression;
import com.cstruct.extractor.extract.model.StructInstance;
import com.cstruct.extractor.extract.model.StructTypeCatalog;
import com.cstruct.extractor.extract.model.StructTypeDefinition;
import com.cstruct.extractor.extract.model.ValueCatalog;
import com.cstruct.extractor.extract.model.ValueKey;
import com.cstruct.extractor.parser.CParser;
import com.cstruct.extractor.parser.CTrees;

import lombok.Getter;
import lombok.Value;

/**
 * Turns initialized declarators into catalog entries.
 *
 * Expression initializers become {@link ScalarValue}s. Brace initializers of a known
 * struct type become {@link StructInstance}s whose bindings pair the list elements with
 * the struct's field names; pairing stops at the shorter of the two. The first value
 * recorded under a key is kept.
 */
public class ValueCatalogBuilder {
    private static final Logger log = LoggerFactory.getLogger(ValueCatalogBuilder.class);

    @Getter
    private final ValueCatalog catalog = new ValueCatalog();
    private final StructTypeCatalog structTypes;
    private final ExpressionSimplifier simplifier;
    private final ExtractionConfig config;

    public ValueCatalogBuilder(StructTypeCatalog structTypes, ExpressionSimplifier simplifier,
            ExtractionConfig config) {
        this.structTypes = structTypes;
        this.simplifier = simplifier;
        this.config = config;
    }

    /**
     * @param currentTag  struct tag named by the declaration's type, if any
     * @param declarator  the declarator carrying {@code initializer}
     * @param initializer never null
     * @return the problem that kept the declaration out of the catalog, if any
     */
    public Optional<ExtractionProblem> recordDeclaration(Optional<String> currentTag,
            CParser.DeclaratorContext declarator, CParser.InitializerContext initializer) {
        Optional<String> identifier = CTrees.simpleIdentifier(declarator);
        if (identifier.isEmpty()) {
            return Optional.of(ExtractionProblem.unexpectedDeclarator(declarator));
        }

        String name = identifier.get();
        ValueKey key = new ValueKey(currentTag.orElse(null), name);

        if (initializer.assignmentExpression() != null) {
            ScalarValue scalar = new ScalarValue(name, simplifier.simplify(initializer.assignmentExpression()));
            if (!catalog.putIfAbsent(key, scalar)) {
                log.debug("{} already recorded, keeping the first value", key);
            }
            return Optional.empty();
        }

        int line = CTrees.line(declarator);
        if (currentTag.isEmpty()) {
            log.debug("Brace initializer of '{}' at line {} has no struct type, ignored", name, line);
            return Optional.empty();
        }

        String tag = currentTag.get();
        Optional<StructTypeDefinition> type = structTypes.find(tag);
        if (type.isEmpty()) {
            return Optional.of(ExtractionProblem.unknownStructType(tag, name, line));
        }
        if (catalog.contains(key)) {
            log.debug("{} already recorded, keeping the first value", key);
            return Optional.empty();
        }

        List<FieldBinding> bindings = bind(elementsOf(initializer), type.get().getFields());
        catalog.putIfAbsent(key, new StructInstance(tag, name, List.copyOf(bindings)));
        log.trace("struct {} {}: {} bindings", tag, name, bindings.size());
        return Optional.empty();
    }

    private List<FieldBinding> bind(List<InitializerElement> elements, List<String> fields) {
        List<FieldBinding> bindings = new ArrayList<>();

        if (config.getInitializerMatching() == InitializerMatching.POSITIONAL) {
            int pairs = Math.min(elements.size(), fields.size());
            for (int i = 0; i < pairs; i++) {
                bindElement(bindings, fields.get(i), elements.get(i).getInitializer());
            }
            return bindings;
        }

        int next = 0;
        for (InitializerElement element : elements) {
            int slot = next;
            Optional<String> member = element.getMember();
            if (member.isPresent()) {
                int index = fields.indexOf(member.get());
                if (index >= 0) {
                    slot = index;
                } else {
                    log.debug("Designator .{} names no known field, using position {}", member.get(), slot);
                }
            }
            if (slot >= fields.size()) {
                continue;
            }
            bindElement(bindings, fields.get(slot), element.getInitializer());
            next = slot + 1;
        }
        return bindings;
    }

    private void bindElement(List<FieldBinding> bindings, String fieldName, CParser.InitializerContext initializer) {
        if (initializer.assignmentExpression() != null) {
            bindings.add(new FieldBinding(fieldName, simplifier.simplify(initializer.assignmentExpression())));
            return;
        }

        if (config.getNestedInitializers() == NestedInitializerMode.AGGREGATE) {
            bindings.add(new FieldBinding(fieldName, aggregate(initializer)));
            return;
        }
        for (InitializerElement element : elementsOf(initializer)) {
            bindElement(bindings, fieldName, element.getInitializer());
        }
    }

    private AggregateValue aggregate(CParser.InitializerContext braced) {
        List<SimpleExpression> elements = new ArrayList<>();
        for (InitializerElement element : elementsOf(braced)) {
            CParser.InitializerContext initializer = element.getInitializer();
            if (initializer.assignmentExpression() != null) {
                elements.add(simplifier.simplify(initializer.assignmentExpression()));
            } else {
                elements.add(aggregate(initializer));
            }
        }
        return new AggregateValue(List.copyOf(elements));
    }

    /**
     * Elements of a brace initializer, each with the member named by its leading
     * {@code .member} designator. {@code {}} has none.
     */
    private static List<InitializerElement> elementsOf(CParser.InitializerContext braced) {
        List<InitializerElement> elements = new ArrayList<>();
        CParser.InitializerListContext list = braced.initializerList();
        if (list == null) {
            return elements;
        }

        Optional<String> member = Optional.empty();
        for (ParseTree child : list.children) {
            if (child instanceof CParser.DesignationContext designation) {
                member = Optional.ofNullable(designation.designatorList().designator(0).Identifier())
                        .map(ParseTree::getText);
            } else if (child instanceof CParser.InitializerContext initializer) {
                elements.add(new InitializerElement(member, initializer));
                member = Optional.empty();
            }
        }
        return elements;
    }

    @Value
    private static class InitializerElement {
        Optional<String> member;
        CParser.InitializerContext initializer;
    }
}
