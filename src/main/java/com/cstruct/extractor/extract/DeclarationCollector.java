package com.cstruct.extractor.extract;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.cstruct.extractor.extract.config.ErrorPolicy;
import com.cstruct.extractor.extract.config.ExtractionConfig;
import com.cstruct.extractor.extract.exception.ExtractionException;
import com.cstruct.extractor.parser.CBaseVisitor;
import com.cstruct.extractor.parser.CParser;
import com.cstruct.extractor.parser.CTrees;

/**
 * Single depth-first walk that feeds both catalog builders.
 *
 * A field belongs to the innermost struct body being walked; untagged bodies push an
 * empty scope so their fields are reported instead of attributed to an outer struct.
 * A declared value belongs to the struct named by its own declaration specifiers,
 * directly ({@code struct point p}) or through a typedef of a tagged struct.
 */
public class DeclarationCollector extends CBaseVisitor<Void> {
    private static final Logger log = LoggerFactory.getLogger(DeclarationCollector.class);

    private final StructTypeCatalogBuilder structTypes;
    private final ValueCatalogBuilder values;
    private final ExtractionConfig config;
    private final ExtractionDiagnostics diagnostics;

    private final Deque<Optional<String>> structScopes = new ArrayDeque<>();
    private final Map<String, String> typedefTags = new HashMap<>();

    public DeclarationCollector(StructTypeCatalogBuilder structTypes, ValueCatalogBuilder values,
            ExtractionConfig config, ExtractionDiagnostics diagnostics) {
        this.structTypes = structTypes;
        this.values = values;
        this.config = config;
        this.diagnostics = diagnostics;
    }

    @Override
    public Void visitDeclaration(CParser.DeclarationContext declaration) {
        if (declaration.declarationSpecifiers() == null) {
            return visitChildren(declaration);
        }
        collect(declaration.declarationSpecifiers(), declaration.initDeclaratorList());
        return null;
    }

    @Override
    public Void visitForDeclaration(CParser.ForDeclarationContext declaration) {
        collect(declaration.declarationSpecifiers(), declaration.initDeclaratorList());
        return null;
    }

    @Override
    public Void visitStructOrUnionSpecifier(CParser.StructOrUnionSpecifierContext struct) {
        if (!CTrees.isDefinition(struct)) {
            return null;
        }
        structScopes.push(CTrees.tagOf(struct));
        try {
            return visitChildren(struct);
        } finally {
            structScopes.pop();
        }
    }

    @Override
    public Void visitStructDeclaration(CParser.StructDeclarationContext structDeclaration) {
        if (structDeclaration.specifierQualifierList() == null) {
            return null;
        }
        visit(structDeclaration.specifierQualifierList());
        if (structDeclaration.structDeclaratorList() == null) {
            return null;
        }

        Optional<String> tag = structScopes.isEmpty() ? Optional.empty() : structScopes.peek();
        for (CParser.StructDeclaratorContext structDeclarator : structDeclaration.structDeclaratorList().structDeclarator()) {
            CParser.DeclaratorContext declarator = structDeclarator.declarator();
            Optional<String> name = declarator != null ? CTrees.simpleIdentifier(declarator) : Optional.empty();
            if (name.isPresent()) {
                structTypes.recordField(tag, name.get());
            } else {
                log.trace("Skipping field declarator at line {}", CTrees.line(structDeclarator));
            }
        }
        return null;
    }

    private void collect(CParser.DeclarationSpecifiersContext specifiers, CParser.InitDeclaratorListContext initDeclarators) {
        Optional<String> tag = resolveTag(specifiers);

        visit(specifiers);
        if (initDeclarators == null) {
            return;
        }

        if (CTrees.isTypedef(specifiers)) {
            tag.ifPresent(t -> registerTypedefs(initDeclarators.initDeclarator(), t));
        } else {
            for (CParser.InitDeclaratorContext initDeclarator : initDeclarators.initDeclarator()) {
                if (initDeclarator.initializer() != null) {
                    values.recordDeclaration(tag, initDeclarator.declarator(), initDeclarator.initializer())
                            .ifPresent(this::handleProblem);
                }
            }
        }

        visit(initDeclarators);
    }

    private Optional<String> resolveTag(CParser.DeclarationSpecifiersContext specifiers) {
        for (CParser.DeclarationSpecifierContext specifier : specifiers.declarationSpecifier()) {
            CParser.TypeSpecifierContext type = specifier.typeSpecifier();
            if (type == null) {
                continue;
            }
            if (type.structOrUnionSpecifier() != null) {
                Optional<String> tag = CTrees.tagOf(type.structOrUnionSpecifier());
                if (tag.isPresent()) {
                    return tag;
                }
            }
            if (type.typedefName() != null && typedefTags.containsKey(type.typedefName().getText())) {
                return Optional.of(typedefTags.get(type.typedefName().getText()));
            }
        }
        return Optional.empty();
    }

    private void registerTypedefs(List<CParser.InitDeclaratorContext> initDeclarators, String tag) {
        for (CParser.InitDeclaratorContext initDeclarator : initDeclarators) {
            CParser.DeclaratorContext declarator = initDeclarator.declarator();
            // typedef struct s *s_ptr names a pointer, not the struct
            if (declarator.pointer() == null && declarator.directDeclarator().Identifier() != null) {
                String name = declarator.directDeclarator().Identifier().getText();
                typedefTags.put(name, tag);
                log.trace("typedef {} -> struct {}", name, tag);
            }
        }
    }

    private void handleProblem(ExtractionProblem problem) {
        diagnostics.getErrors().add(problem.toString());
        if (config.getErrorPolicy() == ErrorPolicy.FAIL_FAST) {
            throw new ExtractionException(problem);
        }
        log.warn("Skipping declaration: {}", problem);
    }
}
