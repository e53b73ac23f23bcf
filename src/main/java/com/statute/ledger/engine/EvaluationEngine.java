package com.statute.ledger.engine;

import com.statute.ledger.condition.ConditionNode;
import com.statute.ledger.core.model.FactContext;
import com.statute.ledger.core.model.Statute;
import com.statute.ledger.decision.DecisionResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;

/**
 * Decides whether a statute applies to a set of facts.
 *
 * <p>Preconditions are checked in declaration order and the first one that is false or cannot be
 * resolved decides the result. When all hold, a statute carrying discretion text is handed to a
 * human ({@link DecisionResult.RequiresDiscretion}); otherwise it applies.</p>
 *
 * <p>Evaluation is a pure function of its inputs and holds no state, so one engine can be shared
 * by any number of threads.</p>
 */
public class EvaluationEngine {
    private static final Logger log = LoggerFactory.getLogger(EvaluationEngine.class);

    /**
     * Evaluates a statute's preconditions against the given facts.
     *
     * @throws MalformedStatuteException if the statute has neither preconditions nor discretion text
     */
    public DecisionResult evaluate(Statute statute, FactContext context) {
        return evaluateWithTrace(statute, context).result();
    }

    /**
     * Same decision as {@link #evaluate}, plus the leaf conditions that were resolved.
     *
     * @throws MalformedStatuteException if the statute has neither preconditions nor discretion text
     */
    public Evaluation evaluateWithTrace(Statute statute, FactContext context) {
        Objects.requireNonNull(statute, "statute is required");
        Objects.requireNonNull(context, "context is required");

        Optional<String> discretion = statute.getDiscretionLogic();
        if (statute.getPreconditions().isEmpty() && discretion.isEmpty()) {
            throw new MalformedStatuteException(statute.getId(),
                    "Statute '" + statute.getId() + "' has no preconditions and no discretion logic");
        }

        ConditionEvaluator evaluator = new ConditionEvaluator(context);
        int index = 0;
        for (ConditionNode precondition : statute.getPreconditions()) {
            ConditionEvaluator.Outcome outcome = evaluator.evaluate(precondition);
            if (outcome.isError()) {
                log.debug("Statute {} precondition {} unresolved: {}",
                        statute.getId(), index, outcome.error().detail());
                return new Evaluation(statute.getId(), outcome.error(), evaluator.trace());
            }
            if (!outcome.value()) {
                log.debug("Statute {} precondition {} not satisfied: {}",
                        statute.getId(), index, precondition.describe());
                return new Evaluation(statute.getId(), DecisionResult.deterministic(false), evaluator.trace());
            }
            index++;
        }

        DecisionResult result = discretion
                .<DecisionResult>map(DecisionResult::requiresDiscretion)
                .orElseGet(() -> DecisionResult.deterministic(true));
        log.debug("Statute {} evaluated for subject {}: {}", statute.getId(), context.getSubjectId(), result.kind());
        return new Evaluation(statute.getId(), result, evaluator.trace());
    }
}
