package org.stepflow.analysis.filter;

public interface PredicateVisitor<R, C> {
    R visitComparison(Predicate.Comparison node, C context);

    R visitLike(Predicate.Like node, C context);

    R visitInList(Predicate.InList node, C context);

    R visitIsNull(Predicate.IsNull node, C context);
}
