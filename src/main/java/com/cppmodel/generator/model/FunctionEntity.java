package com.cppmodel.generator.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

import lombok.AccessLevel;
import lombok.Getter;

/**
 * A free function, member function, constructor or destructor.
 *
 * Parameters are owned by the function but are not body children: a plain
 * declaration keeps them. An out-of-line member of a class template carries
 * the template parameter lists of its enclosing scopes, outermost first.
 */
@Getter
public class FunctionEntity extends Entity {
    private final FunctionKind functionKind;
    private FunctionBodyKind bodyKind = FunctionBodyKind.DECLARATION;
    private boolean variadic;

    @Getter(AccessLevel.NONE)
    private CppType returnType;

    @Getter(AccessLevel.NONE)
    private final List<FunctionParameterEntity> parameters = new ArrayList<>();

    @Getter(AccessLevel.NONE)
    private final Set<FunctionSpecifier> specifiers = EnumSet.noneOf(FunctionSpecifier.class);

    @Getter(AccessLevel.NONE)
    private final List<List<TemplateParameter>> enclosingTemplateParameters = new ArrayList<>();

    private FunctionEntity(String name, FunctionKind functionKind) {
        super(EntityKind.FUNCTION, name);
        this.functionKind = Objects.requireNonNull(functionKind, "functionKind");
    }

    public static Builder builder(String name, FunctionKind functionKind) {
        return new Builder(name, functionKind);
    }

    @Override
    public <R> R accept(EntityVisitor<R> visitor) {
        return visitor.visit(this);
    }

    /**
     * Empty for constructors and destructors.
     */
    public Optional<CppType> getReturnType() {
        return Optional.ofNullable(returnType);
    }

    public List<FunctionParameterEntity> getParameters() {
        return Collections.unmodifiableList(parameters);
    }

    public Set<FunctionSpecifier> getSpecifiers() {
        return Collections.unmodifiableSet(specifiers);
    }

    public boolean hasSpecifier(FunctionSpecifier specifier) {
        return specifiers.contains(specifier);
    }

    public List<List<TemplateParameter>> getEnclosingTemplateParameters() {
        return Collections.unmodifiableList(enclosingTemplateParameters);
    }

    public static final class Builder extends EntityBuilder<FunctionEntity, Builder> {

        private Builder(String name, FunctionKind functionKind) {
            super(new FunctionEntity(name, functionKind));
        }

        @Override
        protected Builder self() {
            return this;
        }

        public Builder returnType(CppType type) {
            get().returnType = type;
            return this;
        }

        public Builder parameter(FunctionParameterEntity parameter) {
            FunctionEntity entity = get();
            entity.adopt(parameter);
            entity.parameters.add(parameter);
            return this;
        }

        public Builder variadic() {
            get().variadic = true;
            return this;
        }

        public Builder specifier(FunctionSpecifier specifier) {
            get().specifiers.add(Objects.requireNonNull(specifier, "specifier"));
            return this;
        }

        /**
         * Adds the parameter list of the next enclosing template scope.
         */
        public Builder enclosingTemplate(List<TemplateParameter> parameters) {
            get().enclosingTemplateParameters.add(List.copyOf(parameters));
            return this;
        }

        public Builder bodyKind(FunctionBodyKind bodyKind) {
            get().bodyKind = Objects.requireNonNull(bodyKind, "bodyKind");
            return this;
        }

        @Override
        protected void discardDefinitionPayload() {
            FunctionEntity entity = get();
            if (entity.bodyKind == FunctionBodyKind.DEFINITION) {
                entity.bodyKind = FunctionBodyKind.DECLARATION;
            }
        }
    }
}
