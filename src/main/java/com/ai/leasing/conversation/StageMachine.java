package com.ai.leasing.conversation;

import com.ai.leasing.conversation.LeadEvent.*;
import com.ai.leasing.conversation.SideEffect.*;
import com.ai.leasing.exception.InvalidTransitionException;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Qualification funnel. Pure: takes a state snapshot and an event, returns the next
 * state and the side effects to run. Nothing here does I/O.
 *
 * <pre>
 * new -> gate_question_payslips -> gate_question_deposit -> gate_question_move_date
 *     -> collecting_profile -> qualified -> scheduling_in_progress -> tour_scheduled
 * </pre>
 * Any gate can drop to gate_failed; qualified can drop to no_fit or future_fit.
 */
@Component
public class StageMachine {

    private static final Map<LeadStage, Set<LeadStage>> EDGES = new EnumMap<>(LeadStage.class);

    static {
        EDGES.put(LeadStage.NEW, EnumSet.of(LeadStage.GATE_QUESTION_PAYSLIPS));
        EDGES.put(LeadStage.GATE_QUESTION_PAYSLIPS,
                EnumSet.of(LeadStage.GATE_QUESTION_DEPOSIT, LeadStage.GATE_FAILED));
        EDGES.put(LeadStage.GATE_QUESTION_DEPOSIT,
                EnumSet.of(LeadStage.GATE_QUESTION_MOVE_DATE, LeadStage.GATE_FAILED));
        EDGES.put(LeadStage.GATE_QUESTION_MOVE_DATE,
                EnumSet.of(LeadStage.COLLECTING_PROFILE, LeadStage.GATE_FAILED));
        EDGES.put(LeadStage.COLLECTING_PROFILE,
                EnumSet.of(LeadStage.COLLECTING_PROFILE, LeadStage.QUALIFIED));
        EDGES.put(LeadStage.QUALIFIED,
                EnumSet.of(LeadStage.SCHEDULING_IN_PROGRESS, LeadStage.NO_FIT, LeadStage.FUTURE_FIT));
        EDGES.put(LeadStage.SCHEDULING_IN_PROGRESS,
                EnumSet.of(LeadStage.TOUR_SCHEDULED, LeadStage.QUALIFIED));
        EDGES.put(LeadStage.TOUR_SCHEDULED, EnumSet.noneOf(LeadStage.class));
        EDGES.put(LeadStage.GATE_FAILED, EnumSet.noneOf(LeadStage.class));
        EDGES.put(LeadStage.NO_FIT, EnumSet.noneOf(LeadStage.class));
        EDGES.put(LeadStage.FUTURE_FIT, EnumSet.noneOf(LeadStage.class));
    }

    private final ProfileCollector profileCollector;
    private final int maxMoveInDays;

    public StageMachine(ProfileCollector profileCollector,
                        @Value("${leasing.qualification.max-move-in-days:60}") int maxMoveInDays) {
        this.profileCollector = profileCollector;
        this.maxMoveInDays = maxMoveInDays;
    }

    public static boolean canTransition(LeadStage from, LeadStage to) {
        return EDGES.getOrDefault(from, Set.of()).contains(to);
    }

    /**
     * @param today local date used to judge the move-in answer
     * @throws InvalidTransitionException when the event is not accepted in the current stage
     *                                    or carries an invalid value
     */
    public Transition advance(QualificationState state, LeadEvent event, LocalDate today) {
        LeadStage from = state.stage();
        if (from.isTerminal()) {
            throw new InvalidTransitionException(from,
                    "Lead is in terminal stage " + from.code() + ", " + event.type() + " rejected");
        }

        Transition transition;
        if (event instanceof ContactStarted) {
            require(from, LeadStage.NEW, event);
            transition = askGate(state, Gate.PAYSLIPS);
        } else if (event instanceof PayslipsAnswered) {
            require(from, LeadStage.GATE_QUESTION_PAYSLIPS, event);
            PayslipsAnswered answer = (PayslipsAnswered) event;
            QualificationState answered = state.withHasPayslips(answer.hasPayslips());
            transition = answer.hasPayslips() ? askGate(answered, Gate.DEPOSIT) : failGate(answered);
        } else if (event instanceof DepositAnswered) {
            require(from, LeadStage.GATE_QUESTION_DEPOSIT, event);
            DepositAnswered answer = (DepositAnswered) event;
            QualificationState answered = state.withCanPayDeposit(answer.canPayDeposit());
            transition = answer.canPayDeposit() ? askGate(answered, Gate.MOVE_IN_DATE) : failGate(answered);
        } else if (event instanceof MoveInDateAnswered) {
            require(from, LeadStage.GATE_QUESTION_MOVE_DATE, event);
            transition = onMoveInDate(state, ((MoveInDateAnswered) event).moveInDate(), today);
        } else if (event instanceof ProfileProvided) {
            require(from, LeadStage.COLLECTING_PROFILE, event);
            transition = onProfile(state, ((ProfileProvided) event).update());
        } else if (event instanceof NoUnitsMatched) {
            require(from, LeadStage.QUALIFIED, event);
            LeadStage outcome = ((NoUnitsMatched) event).reason().outcome();
            transition = new Transition(from, state.withStage(outcome), List.of(new AnnounceOutcome(outcome)));
        } else if (event instanceof TourRequested) {
            require(from, LeadStage.QUALIFIED, event);
            transition = new Transition(from, state.withStage(LeadStage.SCHEDULING_IN_PROGRESS), List.of());
        } else if (event instanceof TourBooked) {
            require(from, LeadStage.SCHEDULING_IN_PROGRESS, event);
            transition = new Transition(from, state.withStage(LeadStage.TOUR_SCHEDULED),
                    List.of(new AnnounceOutcome(LeadStage.TOUR_SCHEDULED)));
        } else if (event instanceof TourBookingFailed) {
            require(from, LeadStage.SCHEDULING_IN_PROGRESS, event);
            transition = new Transition(from, state.withStage(LeadStage.QUALIFIED), List.of(new OfferAnotherSlot()));
        } else {
            throw new InvalidTransitionException(from, "Unsupported event " + event.type());
        }

        if (!canTransition(from, transition.to())) {
            throw new IllegalStateException("Illegal edge " + from.code() + " -> " + transition.to().code());
        }
        return transition;
    }

    private Transition onMoveInDate(QualificationState state, LocalDate moveInDate, LocalDate today) {
        if (moveInDate == null) {
            throw new InvalidTransitionException(state.stage(), "Move-in date is required");
        }
        if (moveInDate.isBefore(today)) {
            throw new InvalidTransitionException(state.stage(), "Move-in date " + moveInDate + " is in the past");
        }
        QualificationState answered = state.withMoveInDate(moveInDate);
        if (moveInDate.isAfter(today.plusDays(maxMoveInDays))) {
            return failGate(answered);
        }
        ProfileField first = profileCollector.nextField(answered.profile()).orElse(ProfileField.ROOMS);
        return new Transition(state.stage(), answered.withStage(LeadStage.COLLECTING_PROFILE),
                List.of(new AskProfileField(first)));
    }

    private Transition onProfile(QualificationState state, LeadProfile update) {
        LeadProfile merged;
        try {
            merged = profileCollector.merge(state.profile(), update);
        } catch (IllegalArgumentException e) {
            throw new InvalidTransitionException(state.stage(), e.getMessage());
        }
        QualificationState collecting = state.withProfile(merged);
        Optional<ProfileField> next = profileCollector.nextField(merged);
        if (next.isPresent()) {
            return new Transition(state.stage(), collecting, List.of(new AskProfileField(next.get())));
        }
        return new Transition(state.stage(), collecting.withStage(LeadStage.QUALIFIED), List.of(new RunUnitMatching()));
    }

    private static Transition askGate(QualificationState state, Gate gate) {
        return new Transition(state.stage(), state.withStage(gate.stage()), List.of(new AskGateQuestion(gate)));
    }

    private static Transition failGate(QualificationState state) {
        return new Transition(state.stage(), state.withStage(LeadStage.GATE_FAILED),
                List.of(new AnnounceOutcome(LeadStage.GATE_FAILED)));
    }

    private static void require(LeadStage actual, LeadStage expected, LeadEvent event) {
        if (actual != expected) {
            throw new InvalidTransitionException(actual,
                    event.type() + " is only accepted in " + expected.code() + ", lead is in " + actual.code());
        }
    }
}
