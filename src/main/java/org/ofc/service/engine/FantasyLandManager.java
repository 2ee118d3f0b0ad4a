package org.ofc.service.engine;

import lombok.RequiredArgsConstructor;
import org.ofc.model.Card;
import org.ofc.model.GameRules;
import org.ofc.model.HandRanking;
import org.ofc.model.HandType;
import org.ofc.model.Row;
import org.ofc.model.ValidationResult;
import org.ofc.model.Variant;
import org.springframework.stereotype.Service;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Fantasy Land qualification rules.
 * <ul>
 *   <li>entry: a top pair of the entry rank (queens by default) or better, or top trips</li>
 *   <li>stay: top trips; with the extended rule also a middle full house+ or bottom quads+</li>
 * </ul>
 */
@Service
@RequiredArgsConstructor
public class FantasyLandManager {
    private final HandEvaluator evaluator;

    public boolean checkEntryQualification(List<Card> topRow) {
        return checkEntryQualification(topRow, Card.Rank.QUEEN);
    }

    public boolean checkEntryQualification(List<Card> topRow, GameRules rules) {
        return checkEntryQualification(topRow, rules.getFantasyLandEntryRank());
    }

    private boolean checkEntryQualification(List<Card> topRow, Card.Rank threshold) {
        if (topRow.size() != Row.TOP.getCapacity()) return false;
        HandRanking top = evaluator.evaluate(topRow);
        if (top.handType() == HandType.TRIPS) return true;
        return top.handType() == HandType.PAIR && top.primaryRank().getValue() >= threshold.getValue();
    }

    public boolean checkStayQualification(List<Card> top, List<Card> middle, List<Card> bottom) {
        return checkStayQualification(top, middle, bottom, true);
    }

    public boolean checkStayQualification(List<Card> top, List<Card> middle, List<Card> bottom, GameRules rules) {
        return checkStayQualification(top, middle, bottom, rules.isExtendedFantasyLandStay());
    }

    private boolean checkStayQualification(List<Card> top, List<Card> middle, List<Card> bottom, boolean extended) {
        if (top.size() == Row.TOP.getCapacity() && evaluator.evaluate(top).handType() == HandType.TRIPS) return true;
        if (!extended) return false;
        if (middle.size() == Row.MIDDLE.getCapacity()
                && evaluator.evaluate(middle).handType().atLeast(HandType.FULL_HOUSE)) return true;
        return bottom.size() == Row.BOTTOM.getCapacity()
                && evaluator.evaluate(bottom).handType().atLeast(HandType.QUADS);
    }

    public int getFantasyLandCardCount(Variant variant) {
        return variant.getFantasyLandCards();
    }

    /** Thirteen distinct cards, all taken from the Fantasy Land deal of the variant's size. */
    public ValidationResult validateFantasyLandPlacement(List<Card> placed, List<Card> dealt, Variant variant) {
        int expected = getFantasyLandCardCount(variant);
        if (dealt.size() != expected)
            return ValidationResult.error("Must deal exactly " + expected + " cards in Fantasy Land, got " + dealt.size());
        if (placed.size() != Row.LAYOUT_SIZE)
            return ValidationResult.error("Must place exactly " + Row.LAYOUT_SIZE + " cards, got " + placed.size());
        Set<Card> placedSet = new HashSet<>(placed);
        if (placedSet.size() != placed.size()) return ValidationResult.error("Duplicate cards in placement");
        if (!new HashSet<>(dealt).containsAll(placedSet))
            return ValidationResult.error("Placed cards not from dealt cards");
        return ValidationResult.ok();
    }
}
