package com.ai.leasing.component;

import com.ai.leasing.conversation.Gate;
import com.ai.leasing.conversation.LeadStage;
import com.ai.leasing.conversation.ProfileField;
import com.ai.leasing.entity.Unit;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Locale;

/**
 * Every sentence the bot sends. Times are rendered in the operator's local zone.
 */
@Component
public class LeasingPhrases {

    private static final DateTimeFormatter TIME = DateTimeFormatter.ofPattern("HH:mm", Locale.ENGLISH);
    private static final DateTimeFormatter DAY = DateTimeFormatter.ofPattern("EEEE, d MMMM", Locale.ENGLISH);
    private static final DateTimeFormatter DATE = DateTimeFormatter.ofPattern("d MMMM yyyy", Locale.ENGLISH);

    private final ZoneId zone;

    public LeasingPhrases(Clock clock) {
        this.zone = clock.getZone();
    }

    public String gateQuestion(Gate gate) {
        switch (gate) {
            case PAYSLIPS:
                return "Hi! Thanks for reaching out. To get started: do you have recent payslips you can show?";
            case DEPOSIT:
                return "Great. Can you pay a security deposit of two months' rent?";
            case MOVE_IN_DATE:
            default:
                return "When would you like to move in?";
        }
    }

    public String profileQuestion(ProfileField field) {
        switch (field) {
            case ROOMS: return "How many rooms are you looking for?";
            case BUDGET: return "What is your monthly budget?";
            case HAS_PARKING: return "Do you need a parking spot?";
            case PREFERRED_AREA: return "Is there an area or building you prefer?";
            case FLOOR_RANGE: return "Any preferred floors? A range like 2-5 works.";
            case NEEDS_FURNISHED: return "Do you need the apartment furnished?";
            case PET_OWNER:
            default:
                return "Last one: do you have pets?";
        }
    }

    public String outcome(LeadStage stage) {
        switch (stage) {
            case GATE_FAILED:
                return "Thanks for your time. Unfortunately we can't move forward right now, "
                        + "but feel free to contact us again if anything changes.";
            case NO_FIT:
                return "Thanks! We don't have a unit matching what you're looking for at the moment. "
                        + "We'll reach out if something opens up.";
            case FUTURE_FIT:
                return "We don't have a matching unit for your move-in date yet, but one is coming up. "
                        + "We'll get back to you closer to the date.";
            case TOUR_SCHEDULED:
                return "Your tour is booked. See you there!";
            default:
                return "Thanks! We'll be in touch.";
        }
    }

    public String futureFit(LocalDate earliest) {
        if (earliest == null) return outcome(LeadStage.FUTURE_FIT);
        return "We don't have a matching unit for your move-in date yet. The earliest one frees up on "
                + earliest.format(DATE) + ". We'll get back to you closer to then.";
    }

    public String recommendations(List<Unit> units) {
        StringBuilder sb = new StringBuilder("Here's what we have for you:");
        for (Unit u : units) {
            sb.append("\n- Unit ").append(u.getUnitNumber())
                    .append(": ").append(u.getRooms()).append(" rooms, ")
                    .append(u.getPrice().stripTrailingZeros().toPlainString()).append(" per month");
            if (u.getAvailableFrom() != null) {
                sb.append(", available from ").append(u.getAvailableFrom().format(DATE));
            }
            if (u.hasImage()) {
                sb.append("\n  Photos: ").append(u.getImageUrl().trim());
            }
        }
        sb.append("\nWould you like to book a tour?");
        return sb.toString();
    }

    public String tourConfirmed(Instant when) {
        return "You're all set! Your tour is confirmed for " + day(when) + " at " + time(when) + ".";
    }

    public String tourBookingFailed() {
        return "Hmm, that slot didn't work out. Want to try a different time?";
    }

    public String tourCanceled() {
        return "Your tour has been canceled. Let us know if you'd like to pick another time.";
    }

    public String eveningBeforeReminder(Instant tour) {
        return "Hi! Just a reminder that we have a tour tomorrow at " + time(tour) + ". Any questions before then?";
    }

    public String morningOfReminder(Instant tour) {
        return "Good morning! Your tour is today at " + time(tour) + ". See you soon!";
    }

    public String threeHoursReminder(Instant tour) {
        return "Your tour starts in three hours, at " + time(tour) + ". Looking forward to meeting you!";
    }

    public String afterTour() {
        return "Thanks for coming to the tour! What did you think? Happy to answer any questions.";
    }

    public String noShow() {
        return "We missed you at the tour today. Would you like to pick another time?";
    }

    public String abandonedNudge() {
        return "Hi! Just checking in. Still looking for an apartment? We can pick up where we left off.";
    }

    private String time(Instant instant) {
        return instant.atZone(zone).format(TIME);
    }

    private String day(Instant instant) {
        return instant.atZone(zone).format(DAY);
    }
}
