package com.natded.proposition;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.util.Objects;

/**
 * Immutable propositional formula.
 *
 * Equality is structural: operand order matters, so {@code And(A, B)} and
 * {@code And(B, A)} are different values. No normalization of any kind is
 * performed. Rules inspect the shape with {@code instanceof} patterns over the
 * closed variant set below.
 *
 * JSON form: {"op": "implies", "left": {"op": "atom", "name": "C"}, "right": ...}
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "op")
@JsonSubTypes({
    @JsonSubTypes.Type(value = Proposition.Atom.class, name = "atom"),
    @JsonSubTypes.Type(value = Proposition.Not.class, name = "not"),
    @JsonSubTypes.Type(value = Proposition.And.class, name = "and"),
    @JsonSubTypes.Type(value = Proposition.Or.class, name = "or"),
    @JsonSubTypes.Type(value = Proposition.Implies.class, name = "implies"),
    @JsonSubTypes.Type(value = Proposition.Iff.class, name = "iff"),
    @JsonSubTypes.Type(value = Proposition.Xor.class, name = "xor"),
    @JsonSubTypes.Type(value = Proposition.Nand.class, name = "nand"),
    @JsonSubTypes.Type(value = Proposition.Nor.class, name = "nor"),
    @JsonSubTypes.Type(value = Proposition.Xnor.class, name = "xnor"),
    @JsonSubTypes.Type(value = Proposition.True.class, name = "true"),
    @JsonSubTypes.Type(value = Proposition.False.class, name = "false")
})
public sealed interface Proposition
    permits Proposition.Atom,
        Proposition.Not,
        Proposition.Binary,
        Proposition.True,
        Proposition.False {

    /** Shared by every two-operand connective. */
    sealed interface Binary extends Proposition
        permits And, Or, Implies, Iff, Xor, Nand, Nor, Xnor {

        Proposition left();

        Proposition right();
    }

    record Atom(String name) implements Proposition {
        public Atom {
            Objects.requireNonNull(name, "name");
        }

        @Override
        public String toString() {
            return name;
        }
    }

    record Not(Proposition operand) implements Proposition {
        public Not {
            Objects.requireNonNull(operand, "operand");
        }

        @Override
        public String toString() {
            return "Not(" + operand + ")";
        }
    }

    record And(Proposition left, Proposition right) implements Binary {
        public And {
            requireOperands(left, right);
        }

        @Override
        public String toString() {
            return binary("And", left, right);
        }
    }

    record Or(Proposition left, Proposition right) implements Binary {
        public Or {
            requireOperands(left, right);
        }

        @Override
        public String toString() {
            return binary("Or", left, right);
        }
    }

    /** {@code left} is the antecedent, {@code right} the consequent. */
    record Implies(Proposition left, Proposition right) implements Binary {
        public Implies {
            requireOperands(left, right);
        }

        public Proposition antecedent() {
            return left;
        }

        public Proposition consequent() {
            return right;
        }

        @Override
        public String toString() {
            return binary("Implies", left, right);
        }
    }

    record Iff(Proposition left, Proposition right) implements Binary {
        public Iff {
            requireOperands(left, right);
        }

        @Override
        public String toString() {
            return binary("Iff", left, right);
        }
    }

    record Xor(Proposition left, Proposition right) implements Binary {
        public Xor {
            requireOperands(left, right);
        }

        @Override
        public String toString() {
            return binary("Xor", left, right);
        }
    }

    record Nand(Proposition left, Proposition right) implements Binary {
        public Nand {
            requireOperands(left, right);
        }

        @Override
        public String toString() {
            return binary("Nand", left, right);
        }
    }

    record Nor(Proposition left, Proposition right) implements Binary {
        public Nor {
            requireOperands(left, right);
        }

        @Override
        public String toString() {
            return binary("Nor", left, right);
        }
    }

    record Xnor(Proposition left, Proposition right) implements Binary {
        public Xnor {
            requireOperands(left, right);
        }

        @Override
        public String toString() {
            return binary("Xnor", left, right);
        }
    }

    @JsonIgnoreProperties(value = {"value"}, allowGetters = true)
    record True() implements Proposition {

        @JsonProperty("value")
        public boolean value() {
            return true;
        }

        @Override
        public String toString() {
            return "True";
        }
    }

    @JsonIgnoreProperties(value = {"value"}, allowGetters = true)
    record False() implements Proposition {

        @JsonProperty("value")
        public boolean value() {
            return false;
        }

        @Override
        public String toString() {
            return "False";
        }
    }

    // ---- factories ----

    Proposition TRUE = new True();
    Proposition FALSE = new False();

    static Atom atom(String name) {
        return new Atom(name);
    }

    static Not not(Proposition operand) {
        return new Not(operand);
    }

    static And and(Proposition left, Proposition right) {
        return new And(left, right);
    }

    static Or or(Proposition left, Proposition right) {
        return new Or(left, right);
    }

    static Implies implies(Proposition antecedent, Proposition consequent) {
        return new Implies(antecedent, consequent);
    }

    static Iff iff(Proposition left, Proposition right) {
        return new Iff(left, right);
    }

    /** Number of nodes in the tree. */
    default int size() {
        if (this instanceof Not not) {
            return 1 + not.operand().size();
        }
        if (this instanceof Binary binary) {
            return 1 + binary.left().size() + binary.right().size();
        }
        return 1;
    }

    private static void requireOperands(Proposition left, Proposition right) {
        Objects.requireNonNull(left, "left");
        Objects.requireNonNull(right, "right");
    }

    private static String binary(String op, Proposition left, Proposition right) {
        return op + "(" + left + ", " + right + ")";
    }
}
