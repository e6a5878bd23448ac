package com.ai.leasing.service;

import com.ai.leasing.component.LeasingPhrases;
import com.ai.leasing.conversation.LeadEvent;
import com.ai.leasing.conversation.LeadStage;
import com.ai.leasing.conversation.SideEffect;
import com.ai.leasing.conversation.StageMachine;
import com.ai.leasing.conversation.Transition;
import com.ai.leasing.dto.AppointmentResponse;
import com.ai.leasing.dto.QualificationResponse;
import com.ai.leasing.dto.UnitSummary;
import com.ai.leasing.entity.Appointment;
import com.ai.leasing.entity.Lead;
import com.ai.leasing.entity.Unit;
import com.ai.leasing.exception.InvalidTransitionException;
import com.ai.leasing.exception.NotFoundException;
import com.ai.leasing.matching.MatchCriteria;
import com.ai.leasing.matching.MatchResult;
import com.ai.leasing.matching.UnitMatcher;
import com.ai.leasing.repository.LeadRepository;
import com.ai.leasing.repository.UnitRepository;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Transactional steps on a single lead. Not thread-safe per lead on its own: callers go
 * through {@link LeadQualificationService}, which holds the lead's lock across the commit.
 */
@Service
public class LeadTransitionService {

    private static final Logger log = LoggerFactory.getLogger(LeadTransitionService.class);

    private final LeadRepository leadRepository;
    private final UnitRepository unitRepository;
    private final StageMachine stageMachine;
    private final UnitMatcher unitMatcher;
    private final AppointmentScheduler appointmentScheduler;
    private final FollowupScheduler followupScheduler;
    private final ConversationLogService conversationLog;
    private final LeasingPhrases phrases;
    private final Clock clock;
    private final int maxRecommendations;

    public LeadTransitionService(LeadRepository leadRepository,
                                 UnitRepository unitRepository,
                                 StageMachine stageMachine,
                                 UnitMatcher unitMatcher,
                                 AppointmentScheduler appointmentScheduler,
                                 FollowupScheduler followupScheduler,
                                 ConversationLogService conversationLog,
                                 LeasingPhrases phrases,
                                 Clock clock,
                                 @Value("${leasing.matching.max-recommendations:3}") int maxRecommendations) {
        this.leadRepository = leadRepository;
        this.unitRepository = unitRepository;
        this.stageMachine = stageMachine;
        this.unitMatcher = unitMatcher;
        this.appointmentScheduler = appointmentScheduler;
        this.followupScheduler = followupScheduler;
        this.conversationLog = conversationLog;
        this.phrases = phrases;
        this.clock = clock;
        this.maxRecommendations = maxRecommendations;
    }

    @Transactional(readOnly = true)
    public LeadStage currentStage(String phone) {
        return leadRepository.findByPhoneNumber(phone).map(Lead::getStage).orElse(LeadStage.NEW);
    }

    /**
     * Applies one inbound event. A lead is created on its first contact; any other event
     * for an unknown phone is rejected like an out-of-order event.
     *
     * @throws InvalidTransitionException when the event is not accepted in the lead's stage
     */
    @Transactional
    public QualificationResponse applyEvent(String phone, LeadEvent event, InboundContext context) {
        Lead lead = leadRepository.findByPhoneNumber(phone).orElse(null);
        if (lead == null) {
            if (!(event instanceof LeadEvent.ContactStarted)) {
                throw new InvalidTransitionException(LeadStage.NEW,
                        "No conversation with " + phone + " yet, " + event.type() + " rejected");
            }
            lead = newLead(phone, context);
        } else if (conversationLog.isDuplicate(lead, context.messageId())) {
            log.info("Duplicate message {} from {} ignored", context.messageId(), phone);
            return QualificationResponse.builder()
                    .phone(phone)
                    .previousStage(lead.getStage().code())
                    .stage(lead.getStage().code())
                    .duplicate(true)
                    .build();
        }
        if (StringUtils.equals(lead.getName(), lead.getPhoneNumber()) && StringUtils.isNotBlank(context.name())) {
            lead.setName(context.name().trim());
        }

        LocalDate today = LocalDate.now(clock);
        Transition transition = stageMachine.advance(lead.toState(), event, today);
        Instant now = clock.instant();
        lead.applyState(transition.next(), now);
        lead = leadRepository.save(lead);

        if (event.isSystem()) {
            conversationLog.logSystem(lead, event.type(), transitionMetadata(event, transition));
        } else {
            conversationLog.logUser(lead, StringUtils.defaultIfBlank(context.text(), event.type()),
                    context.messageId(), transitionMetadata(event, transition));
        }
        followupScheduler.cancelPendingNudges(lead);
        log.info("Lead {}: {} -> {} on {}", phone, transition.from().code(), transition.to().code(), event.type());

        QualificationResponse.QualificationResponseBuilder response = QualificationResponse.builder()
                .phone(phone)
                .previousStage(transition.from().code());
        List<String> replies = new ArrayList<>();
        for (SideEffect effect : transition.effects()) {
            if (effect instanceof SideEffect.AskGateQuestion) {
                replies.add(phrases.gateQuestion(((SideEffect.AskGateQuestion) effect).gate()));
            } else if (effect instanceof SideEffect.AskProfileField) {
                replies.add(phrases.profileQuestion(((SideEffect.AskProfileField) effect).field()));
            } else if (effect instanceof SideEffect.AnnounceOutcome) {
                replies.add(phrases.outcome(((SideEffect.AnnounceOutcome) effect).outcome()));
            } else if (effect instanceof SideEffect.OfferAnotherSlot) {
                replies.add(phrases.tourBookingFailed());
            } else if (effect instanceof SideEffect.RunUnitMatching) {
                runMatching(lead, today, now, replies, response);
            }
        }
        for (String reply : replies) {
            conversationLog.logBot(lead, reply, Map.of("stage", lead.getStage().code()));
        }
        return response.stage(lead.getStage().code()).replies(replies).build();
    }

    /**
     * Books the tour for a lead in scheduling and moves it to tour_scheduled. Both happen or neither.
     */
    @Transactional
    public AppointmentResponse bookTour(String phone, Long unitId, Instant scheduledTime) {
        Lead lead = requireLead(phone);
        Appointment appointment = appointmentScheduler.propose(lead, unitId, scheduledTime);
        LeadEvent booked = new LeadEvent.TourBooked();
        Transition transition = stageMachine.advance(lead.toState(), booked, LocalDate.now(clock));
        lead.applyState(transition.next(), clock.instant());
        leadRepository.save(lead);
        conversationLog.logSystem(lead, booked.type(), transitionMetadata(booked, transition));
        String reply = phrases.tourConfirmed(appointment.getScheduledTime());
        conversationLog.logBot(lead, reply, Map.of("appointment_id", appointment.getId()));
        log.info("Lead {}: {} -> {} with tour {}", phone, transition.from().code(), transition.to().code(),
                appointment.getId());
        return AppointmentResponse.of(appointment, lead.getStage().code(), reply);
    }

    /** Moves a lead whose booking already happened to a new slot. The stage stays tour_scheduled. */
    @Transactional
    public AppointmentResponse rescheduleTour(String phone, Long unitId, Instant scheduledTime) {
        Lead lead = requireLead(phone);
        Appointment appointment = appointmentScheduler.propose(lead, unitId, scheduledTime);
        lead.touch(clock.instant());
        leadRepository.save(lead);
        String reply = phrases.tourConfirmed(appointment.getScheduledTime());
        conversationLog.logBot(lead, reply, Map.of("appointment_id", appointment.getId(), "rescheduled", true));
        return AppointmentResponse.of(appointment, lead.getStage().code(), reply);
    }

    private void runMatching(Lead lead, LocalDate today, Instant now, List<String> replies,
                             QualificationResponse.QualificationResponseBuilder response) {
        List<Unit> snapshot = unitRepository.findSnapshotByStatus(Unit.Status.AVAILABLE);
        MatchResult result = unitMatcher.match(MatchCriteria.from(lead.toState()), snapshot, today);
        if (result.hasMatches()) {
            List<Unit> top = result.top(maxRecommendations);
            replies.add(phrases.recommendations(top));
            response.recommendations(top.stream().map(UnitSummary::of).collect(Collectors.toList()));
            log.info("Lead {} matched {} unit(s), recommending {}", lead.getPhoneNumber(), result.units().size(),
                    top.stream().map(Unit::getUnitNumber).collect(Collectors.toList()));
            return;
        }

        LeadEvent noMatch = new LeadEvent.NoUnitsMatched(result.reason());
        Transition transition = stageMachine.advance(lead.toState(), noMatch, today);
        lead.applyState(transition.next(), now);
        leadRepository.save(lead);
        Map<String, Object> meta = transitionMetadata(noMatch, transition);
        meta.put("reason", result.reason().name());
        conversationLog.logBot(lead, "No matching units", meta);
        replies.add(result.earliestAvailable() != null
                ? phrases.futureFit(result.earliestAvailable())
                : phrases.outcome(transition.to()));
        response.noMatchReason(result.reason().name()).earliestAvailable(result.earliestAvailable());
        log.info("Lead {} has no match ({}), now {}", lead.getPhoneNumber(), result.reason(), transition.to().code());
    }

    private Lead newLead(String phone, InboundContext context) {
        Instant now = clock.instant();
        Lead lead = Lead.builder()
                .phoneNumber(phone)
                .name(StringUtils.defaultIfBlank(StringUtils.trimToNull(context.name()), phone))
                .createdAt(now)
                .updatedAt(now)
                .lastInteraction(now)
                .build();
        log.info("New lead {}", phone);
        return leadRepository.save(lead);
    }

    private Lead requireLead(String phone) {
        return leadRepository.findByPhoneNumber(phone)
                .orElseThrow(() -> new NotFoundException("Lead " + phone + " not found"));
    }

    private static Map<String, Object> transitionMetadata(LeadEvent event, Transition transition) {
        Map<String, Object> meta = new LinkedHashMap<>();
        meta.put("event", event.type());
        meta.put("from", transition.from().code());
        meta.put("to", transition.to().code());
        return meta;
    }
}
