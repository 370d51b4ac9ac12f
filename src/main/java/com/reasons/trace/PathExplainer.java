package com.reasons.trace;

import com.reasons.runtime.Values;
import com.reasons.tree.TreeNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Explains an outcome by the conditions and actions on the path to it.
 */
public class PathExplainer implements Explainer {

    private final List<String> reasons = new ArrayList<>();
    private String lastOutcome;

    @Override
    public void reportCondition(TreeNode node, boolean branchTaken) {
        reasons.add(node.getCondition() + " was " + branchTaken);
    }

    @Override
    public void reportConsequence(TreeNode node, boolean success) {
        reasons.add("action " + node.getActions() + (success ? " succeeded" : " failed"));
    }

    @Override
    public void reportOutcome(TreeNode node) {
        lastOutcome = Values.format(node.getValue());
    }

    @Override
    public String generateExplanation(TreeNode node) {
        String outcome = node != null ? Values.format(node.getValue()) : lastOutcome;
        if (reasons.isEmpty()) {
            return "Outcome '" + outcome + "' is unconditional";
        }
        return "Outcome '" + outcome + "' because " + String.join(", then ", reasons);
    }

    /**
     * Explanation of everything reported since the last reset.
     */
    public String explanation() {
        if (lastOutcome == null) {
            return reasons.isEmpty() ? "No decision was made" : "No outcome reached after " + String.join(", then ", reasons);
        }
        return generateExplanation(null);
    }

    public List<String> reasons() {
        return List.copyOf(reasons);
    }

    public void reset() {
        reasons.clear();
        lastOutcome = null;
    }
}
