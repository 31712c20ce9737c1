package dumb.tdfol.rule;

import dumb.tdfol.AbstractProverTest;
import dumb.tdfol.Formula;
import dumb.tdfol.Term;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.Arrays;
import java.util.HashSet;

import static org.junit.jupiter.api.Assertions.*;

class InferenceRulesTest extends AbstractProverTest {

    private static Formula[] premises(String list) {
        return Arrays.stream(list.split(";")).map(String::trim).map(AbstractProverTest::parse).toArray(Formula[]::new);
    }

    private static InferenceRule rule(String name) {
        return InferenceRules.byName(name).orElseThrow(() -> new AssertionError("No rule " + name));
    }

    @ParameterizedTest(name = "{0}")
    @CsvSource(delimiterString = "::", value = {
            "ModusPonens :: A; A -> B :: B",
            "ModusTollens :: A -> B; ~B :: ~A",
            "ConjunctionIntroduction :: A; B :: A & B",
            "ConjunctionEliminationLeft :: A & B :: A",
            "ConjunctionEliminationRight :: A & B :: B",
            "DisjunctionIntroduction :: A; B :: A | B",
            "DisjunctiveSyllogism :: A | B; ~A :: B",
            "HypotheticalSyllogism :: A -> B; B -> C :: A -> C",
            "Contraposition :: A -> B :: ~B -> ~A",
            "DoubleNegationIntroduction :: A :: ~~A",
            "DoubleNegationElimination :: ~~A :: A",
            "DeMorganAnd :: ~(A & B) :: ~A | ~B",
            "DeMorganOr :: ~(A | B) :: ~A & ~B",
            "UniversalInstantiation :: forall x. Human(x) :: Human(x)",
            "ExistentialGeneralization :: Human(socrates) :: exists x. Human(x)",
            "TemporalKAxiom :: [](A -> B); []A :: []B",
            "TemporalTAxiom :: []A :: A",
            "TemporalS4Axiom :: []A :: [][]A",
            "TemporalS5Axiom :: <>A :: []<>A",
            "AlwaysNecessitation :: A :: []A",
            "AlwaysDistribution :: [](A & B) :: []A & []B",
            "EventuallyIntroduction :: A :: <>A",
            "EventuallyExpansion :: <>A :: A | X(<>A)",
            "EventuallyAggregation :: <>A | <>B :: <>(A | B)",
            "AlwaysEventuallyContraction :: ~<>~A :: []A",
            "AlwaysEventuallyExpansion :: []A :: ~<>~A",
            "NextDistribution :: X(A & B) :: X(A) & X(B)",
            "UntilUnfolding :: A U B :: B | (A & X(A U B))",
            "UntilInduction :: B | (A & X(A U B)) :: A U B",
            "UntilInductionStep :: B; A :: A U B",
            "UntilReleaseDuality :: A U B :: ~(~A R ~B)",
            "WeakUntilExpansion :: A W B :: (A U B) | []A",
            "ReleaseCoinduction :: A R B :: B & (A | X(A R B))",
            "TemporalInduction :: A; [](A -> X(A)) :: []A",
            "UntilEventuality :: A U B :: <>B",
            "DeonticDAxiom :: O(A) :: P(A)",
            "DeonticKAxiom :: O(A -> B); O(A) :: O(B)",
            "DeonticNecessitation :: A :: O(A)",
            "DeonticDetachment :: A; A -> O(B) :: O(B)",
            "PermissionIntroduction :: A :: P(A)",
            "PermissionStrengthening :: P(A & B) :: P(A)",
            "PermissionNegation :: P(A) :: ~O(~A)",
            "PermissionTemporalWeakening :: P(A) :: P(<>A)",
            "ProhibitionFromObligation :: O(~A) :: F(A)",
            "ProhibitionEquivalence :: F(A) :: O(~A)",
            "ObligationWeakening :: O(A & B) :: O(A)",
            "ObligationConsistency :: O(A) :: ~O(~A)",
            "ObligationEventuallyWeakening :: O(A) :: O(<>A)",
            "ObligationAggregation :: O(A); O(B) :: O(A & B)",
            "ProhibitionNotPermitted :: F(A) :: ~P(A)",
            "PermissionFromNegatedObligation :: ~O(~A) :: P(A)",
            "AlwaysObligationDistribution :: []O(A & B) :: []O(A) & []O(B)",
            "AlwaysPermission :: P([]A) :: []P(A)",
            "ContraryToDuty :: O(A); ~A; ~A -> O(B) :: O(B)",
            "DeonticTemporalIntroduction :: O(A) :: O(X(A))",
            "TemporalObligationPersistence :: O([]A) :: []O(A)",
            "FutureTemporalObligationPersistence :: []O(A) :: X([]O(A))",
            "UntilObligation :: O(A U B) :: <>O(B)",
            "ObligationEventually :: O(<>A) :: <>O(A)",
            "EventuallyForbidden :: F(<>A) :: []F(A)"
    })
    void derivesConclusion(String name, String premises, String conclusion) {
        var r = rule(name);
        var p = premises(premises);
        assertTrue(r.canApply(p), () -> name + " should apply to " + premises);
        assertEquals(parse(conclusion), r.apply(p));
    }

    @ParameterizedTest(name = "{0}")
    @CsvSource(delimiterString = "::", value = {
            "ModusPonens :: B; A -> B",
            "ModusTollens :: A -> B; ~A",
            "ConjunctionIntroduction :: A",
            "ConjunctionEliminationLeft :: A | B",
            "ConjunctionEliminationRight :: A -> B",
            "DisjunctionIntroduction :: A",
            "DisjunctiveSyllogism :: A | B; ~C",
            "HypotheticalSyllogism :: A -> B; C -> A",
            "Contraposition :: A & B",
            "DoubleNegationIntroduction :: A; B",
            "DoubleNegationElimination :: ~A",
            "DeMorganAnd :: ~(A | B)",
            "DeMorganOr :: ~(A & B)",
            "UniversalInstantiation :: exists x. Human(x)",
            "ExistentialGeneralization :: A; B",
            "TemporalKAxiom :: [](A -> B); []C",
            "TemporalTAxiom :: <>A",
            "TemporalS4Axiom :: <>A",
            "TemporalS5Axiom :: []A",
            "AlwaysNecessitation :: A; B",
            "AlwaysDistribution :: [](A | B)",
            "EventuallyIntroduction :: A; B",
            "EventuallyExpansion :: []A",
            "EventuallyAggregation :: <>A & <>B",
            "AlwaysEventuallyContraction :: ~<>A",
            "AlwaysEventuallyExpansion :: <>A",
            "NextDistribution :: X(A | B)",
            "UntilUnfolding :: A W B",
            "UntilInduction :: B | (A & X(B U A))",
            "UntilInductionStep :: A",
            "UntilReleaseDuality :: A R B",
            "WeakUntilExpansion :: A U B",
            "ReleaseCoinduction :: A U B",
            "TemporalInduction :: A; [](B -> X(B))",
            "UntilEventuality :: A R B",
            "DeonticDAxiom :: P(A)",
            "DeonticKAxiom :: O(A -> B); O(C)",
            "DeonticNecessitation :: A; B",
            "DeonticDetachment :: A; A -> B",
            "PermissionIntroduction :: A; B",
            "PermissionStrengthening :: P(A | B)",
            "PermissionNegation :: O(A)",
            "PermissionTemporalWeakening :: O(A)",
            "ProhibitionFromObligation :: O(A)",
            "ProhibitionEquivalence :: O(A)",
            "ObligationWeakening :: O(A | B)",
            "ObligationConsistency :: P(A)",
            "ObligationEventuallyWeakening :: F(A)",
            "ObligationAggregation :: O(A); P(B)",
            "ProhibitionNotPermitted :: O(A)",
            "PermissionFromNegatedObligation :: ~O(A)",
            "AlwaysObligationDistribution :: []P(A & B)",
            "AlwaysPermission :: P(<>A)",
            "ContraryToDuty :: O(A); ~B; ~B -> O(C)",
            "DeonticTemporalIntroduction :: P(A)",
            "TemporalObligationPersistence :: O(<>A)",
            "FutureTemporalObligationPersistence :: []P(A)",
            "UntilObligation :: O(A W B)",
            "ObligationEventually :: O([]A)",
            "EventuallyForbidden :: F([]A)"
    })
    void rejectsNonMatchingPremises(String name, String premises) {
        var r = rule(name);
        var p = premises(premises);
        assertFalse(r.canApply(p), () -> name + " should not apply to " + premises);
        var e = assertThrows(RuleApplicationException.class, () -> r.apply(p));
        assertEquals(name, e.ruleName());
    }

    @Test
    void libraryHasSixtyUniquelyNamedRules() {
        assertEquals(60, InferenceRules.all().size());
        var names = new HashSet<String>();
        InferenceRules.all().forEach(r -> assertTrue(names.add(r.name()), r.name()));
        assertEquals(15, InferenceRules.basic().size());
        assertEquals(20, InferenceRules.temporal().size());
        assertEquals(16, InferenceRules.deontic().size());
        assertEquals(9, InferenceRules.combined().size());
        assertTrue(InferenceRules.byName("NoSuchRule").isEmpty());
    }

    @Test
    void onlyNecessitationRulesAreRestrictedToTheorems() {
        var restricted = InferenceRules.all().stream().filter(InferenceRule::necessitation).map(InferenceRule::name).toList();
        assertEquals(java.util.List.of("AlwaysNecessitation", "DeonticNecessitation"), restricted);
    }

    @Test
    void nullPremisesNeverApply() {
        assertFalse(BasicRules.MODUS_PONENS.canApply(parse("A"), null));
        assertFalse(BasicRules.DOUBLE_NEGATION_INTRODUCTION.canApply((Formula[]) null));
    }

    @Test
    void instantiationWithExplicitTerm() {
        var f = parse("forall x. (Human(x) -> Mortal(x))");
        assertEquals(parse("Human(socrates) -> Mortal(socrates)"),
                BasicRules.UNIVERSAL_INSTANTIATION.instantiate(f, Term.constant("socrates")));
        assertThrows(RuleApplicationException.class,
                () -> BasicRules.UNIVERSAL_INSTANTIATION.instantiate(parse("Human(a)"), Term.constant("a")));
    }

    @Test
    void generalizationOverChosenTerm() {
        var g = BasicRules.EXISTENTIAL_GENERALIZATION.generalize(parse("Loves(john, mary)"), Term.constant("mary"), Term.var("y"));
        assertEquals(parse("exists y. Loves(john, y)"), g);
    }
}
