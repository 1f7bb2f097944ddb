package com.cellparser.jackson;

import com.cellparser.ast.*;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.Version;
import com.fasterxml.jackson.databind.BeanDescription;
import com.fasterxml.jackson.databind.SerializationConfig;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.fasterxml.jackson.databind.ser.BeanPropertyWriter;
import com.fasterxml.jackson.databind.ser.BeanSerializerModifier;

import java.lang.reflect.Method;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Jackson module for the AST classes.
 *
 * This module handles:
 * - the {@code type} and {@code loc} properties of every node
 * - dropping the startLine/startCol/endLine/endCol fields that loc replaces
 * - null members that ESTree always writes (function ids, if alternates)
 * - cell properties, with file attachments as lists of {start, end} spans
 * - JavaScript-compatible number serialization
 */
public class AstModule extends SimpleModule {

    // Replaced by loc
    private static final Set<String> EXCLUDED_FIELDS = Set.of("startLine", "startCol", "endLine", "endCol");

    public AstModule() {
        super("AstModule", new Version(1, 0, 0, null, "com.cellparser", "cellparser-jackson"));
    }

    @Override
    public void setupModule(SetupContext context) {
        super.setupModule(context);

        context.setMixInAnnotations(Node.class, NodeMixin.class);
        context.setMixInAnnotations(Statement.class, NodeMixin.class);
        context.setMixInAnnotations(Expression.class, NodeMixin.class);
        context.setMixInAnnotations(Pattern.class, NodeMixin.class);
        context.setMixInAnnotations(CellName.class, NodeMixin.class);
        context.setMixInAnnotations(ImportDeclaration.class, NodeMixin.class);
        context.setMixInAnnotations(ImportSpecifier.class, NodeMixin.class);
        context.setMixInAnnotations(CellModule.class, NodeMixin.class);

        context.setMixInAnnotations(Cell.class, CellMixin.class);
        context.setMixInAnnotations(Literal.class, LiteralMixin.class);
        context.setMixInAnnotations(MethodDefinition.class, MethodDefinitionMixin.class);
        context.setMixInAnnotations(ArrowFunctionExpression.class, FunctionIdMixin.class);
        context.setMixInAnnotations(FunctionExpression.class, FunctionIdMixin.class);
        context.setMixInAnnotations(FunctionDeclaration.class, FunctionIdMixin.class);
        context.setMixInAnnotations(ClassDeclaration.class, ClassMixin.class);
        context.setMixInAnnotations(ClassExpression.class, ClassMixin.class);
        context.setMixInAnnotations(IfStatement.class, IfStatementMixin.class);
        context.setMixInAnnotations(CatchClause.class, CatchClauseMixin.class);
        context.setMixInAnnotations(VariableDeclarator.class, VariableDeclaratorMixin.class);
        context.setMixInAnnotations(TemplateElement.TemplateElementValue.class, TemplateElementValueMixin.class);

        context.addBeanSerializerModifier(new AstSerializerModifier());
    }

    // ==================== Serialization Mixins ====================

    @JsonPropertyOrder({"type", "start", "end", "loc"})
    private abstract static class NodeMixin {
        @JsonProperty("type")
        abstract String type();
        @JsonProperty("start")
        abstract int start();
        @JsonProperty("end")
        abstract int end();
        @JsonProperty("loc")
        abstract SourceLocation loc();
    }

    // Cell is a class, not a record, so every property is named here
    @JsonPropertyOrder({"type", "start", "end", "loc", "id", "async", "generator", "body", "fileAttachments", "references"})
    private abstract static class CellMixin extends NodeMixin {
        @JsonProperty("id")
        @JsonInclude(JsonInclude.Include.ALWAYS)
        abstract CellName id();
        @JsonProperty("body")
        @JsonInclude(JsonInclude.Include.ALWAYS)
        abstract Node body();
        @JsonProperty("async")
        abstract boolean async();
        @JsonProperty("generator")
        abstract boolean generator();
        @JsonProperty("fileAttachments")
        abstract Map<String, List<Span>> fileAttachments();
        @JsonProperty("references")
        abstract List<CellName> references();
        @JsonIgnore
        abstract String input();
    }

    private abstract static class LiteralMixin extends NodeMixin {
        @JsonSerialize(using = JavaScriptNumberSerializer.class)
        @JsonInclude(JsonInclude.Include.ALWAYS)
        abstract Object value();
    }

    private abstract static class MethodDefinitionMixin extends NodeMixin {
        @JsonProperty("static")
        abstract boolean isStatic();
    }

    private abstract static class FunctionIdMixin extends NodeMixin {
        @JsonInclude(JsonInclude.Include.ALWAYS)
        abstract Identifier id();
    }

    private abstract static class ClassMixin extends NodeMixin {
        @JsonInclude(JsonInclude.Include.ALWAYS)
        abstract Identifier id();
        @JsonInclude(JsonInclude.Include.ALWAYS)
        abstract Expression superClass();
    }

    private abstract static class IfStatementMixin extends NodeMixin {
        @JsonInclude(JsonInclude.Include.ALWAYS)
        abstract Statement alternate();
    }

    // null for an optional catch binding
    private abstract static class CatchClauseMixin extends NodeMixin {
        @JsonInclude(JsonInclude.Include.ALWAYS)
        abstract Pattern param();
    }

    private abstract static class VariableDeclaratorMixin extends NodeMixin {
        @JsonInclude(JsonInclude.Include.ALWAYS)
        abstract Expression init();
    }

    // cooked is null for an invalid escape in a tagged template
    private abstract static class TemplateElementValueMixin {
        @JsonInclude(JsonInclude.Include.ALWAYS)
        abstract String cooked();
    }

    // ==================== Serializer Modifier ====================

    private static class AstSerializerModifier extends BeanSerializerModifier {
        @Override
        public List<BeanPropertyWriter> changeProperties(SerializationConfig config,
                                                         BeanDescription beanDesc,
                                                         List<BeanPropertyWriter> beanProperties) {
            Class<?> beanClass = beanDesc.getBeanClass();
            if (!Node.class.isAssignableFrom(beanClass)) {
                return beanProperties;
            }

            List<BeanPropertyWriter> filtered = new ArrayList<>();
            boolean hasType = false;
            boolean hasLoc = false;
            for (BeanPropertyWriter prop : beanProperties) {
                if (EXCLUDED_FIELDS.contains(prop.getName())) {
                    continue;
                }
                hasType |= "type".equals(prop.getName());
                hasLoc |= "loc".equals(prop.getName());
                filtered.add(prop);
            }

            // Mixins on interfaces are not always applied to the implementing records
            if (!hasType) {
                filtered.add(0, new AccessorPropertyWriter("type", accessor(beanClass, "type")));
            }
            if (!hasLoc) {
                filtered.add(new AccessorPropertyWriter("loc", accessor(beanClass, "loc")));
            }
            return filtered;
        }

        private static Method accessor(Class<?> beanClass, String name) {
            try {
                return beanClass.getMethod(name);
            } catch (NoSuchMethodException e) {
                throw new IllegalStateException(beanClass.getName() + " has no " + name + "() accessor", e);
            }
        }
    }

    /**
     * Writes the result of a no-argument accessor under a fixed name.
     */
    private static class AccessorPropertyWriter extends BeanPropertyWriter {
        private final String name;
        private final Method accessor;

        AccessorPropertyWriter(String name, Method accessor) {
            super();
            this.name = name;
            this.accessor = accessor;
        }

        @Override
        public String getName() {
            return name;
        }

        @Override
        public void serializeAsField(Object bean, JsonGenerator gen, SerializerProvider prov) throws Exception {
            Object value = accessor.invoke(bean);
            if (value != null) {
                gen.writeFieldName(name);
                prov.defaultSerializeValue(value, gen);
            }
        }
    }
}
