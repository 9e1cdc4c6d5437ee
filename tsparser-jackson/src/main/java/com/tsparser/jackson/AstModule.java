package com.tsparser.jackson;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.core.Version;
import com.fasterxml.jackson.databind.BeanDescription;
import com.fasterxml.jackson.databind.SerializationConfig;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.fasterxml.jackson.databind.ser.BeanPropertyWriter;
import com.fasterxml.jackson.databind.ser.BeanSerializerModifier;
import com.tsparser.TokenType;
import com.tsparser.ast.AstNode;
import com.tsparser.ast.DeclarationExpression;
import com.tsparser.ast.NumberLiteral;
import com.tsparser.ast.Span;
import com.tsparser.ast.TypeReference;
import com.tsparser.ast.VariableDeclaration;
import com.tsparser.ast.VariableKeyword;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Jackson module describing how syntax tree nodes are written:
 * <ul>
 *   <li>every node gets {@code type}, {@code start} and {@code end} first</li>
 *   <li>spans and derived accessors are left out</li>
 *   <li>initializers are written as their expression, or null</li>
 *   <li>declarations always carry {@code typeReference}, null when there is none</li>
 * </ul>
 */
public class AstModule extends SimpleModule {

    // Accessors that duplicate start/end or are derived from other fields
    private static final Set<String> EXCLUDED_FIELDS = Set.of("position", "span", "constant");

    public AstModule() {
        super("AstModule", new Version(0, 1, 0, null, "com.tsparser", "tsparser-jackson"));
        addSerializer(DeclarationExpression.class, new DeclarationExpressionSerializer());
    }

    @Override
    public void setupModule(SetupContext context) {
        super.setupModule(context);

        context.setMixInAnnotations(AstNode.class, NodeMixin.class);
        context.setMixInAnnotations(NumberLiteral.class, NumberLiteralMixin.class);
        context.setMixInAnnotations(VariableDeclaration.class, VariableDeclarationMixin.class);
        context.setMixInAnnotations(VariableKeyword.class, VariableKeywordMixin.class);

        context.addBeanSerializerModifier(new AstSerializerModifier());
    }

    // ==================== Serialization Mixins ====================

    @JsonPropertyOrder({"type", "start", "end"})
    private interface NodeMixin {
        @JsonProperty("type")
        String type();

        @JsonProperty("start")
        int start();

        @JsonProperty("end")
        int end();

        @JsonIgnore
        Span getPosition();
    }

    private interface NumberLiteralMixin extends NodeMixin {
        @JsonSerialize(using = NumberValueSerializer.class)
        double value();
    }

    private interface VariableDeclarationMixin extends NodeMixin {
        @JsonInclude(JsonInclude.Include.ALWAYS)
        TypeReference typeReference();
    }

    private interface VariableKeywordMixin extends NodeMixin {
        @JsonProperty("kind")
        TokenType tokenType();
    }

    // ==================== Serializer Modifier ====================

    private static class AstSerializerModifier extends BeanSerializerModifier {
        @Override
        public List<BeanPropertyWriter> changeProperties(SerializationConfig config,
                                                         BeanDescription beanDesc,
                                                         List<BeanPropertyWriter> beanProperties) {
            if (!AstNode.class.isAssignableFrom(beanDesc.getBeanClass())) {
                return beanProperties;
            }
            List<BeanPropertyWriter> filtered = new ArrayList<>();
            for (BeanPropertyWriter prop : beanProperties) {
                if (!EXCLUDED_FIELDS.contains(prop.getName())) {
                    filtered.add(prop);
                }
            }
            return filtered;
        }
    }
}
