package com.my.seatbot.domain.service;

import com.my.seatbot.domain.model.AdminReviewSession;
import com.my.seatbot.domain.model.DonationClaim;
import com.my.seatbot.domain.model.NotifierSettings;
import com.my.seatbot.domain.model.TelegramOutgoingMessage;
import com.my.seatbot.domain.port.out.ClockPort;
import com.my.seatbot.domain.port.out.TelegramSendPort;
import com.my.seatbot.domain.port.out.TranslationPort;
import org.jboss.logging.Logger;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Two-step chat dialogue for reviewing pending donation claims: pick a claim by number, then
 * verify ({@code 1}) or reject ({@code 2}) it. {@code /cancel} leaves at any step.
 *
 * <p>Sessions live in memory only and expire after the configured TTL. The list of claims is a
 * snapshot taken when the session opens, so a claim removed in the meantime can still be selected.
 */
public class AdminReviewConversation {

    private static final Logger log = Logger.getLogger(AdminReviewConversation.class);

    static final String CANCEL = "/cancel";
    static final String VERIFY = "1";
    static final String REJECT = "2";

    private final NotifierSettings settings;
    private final DonationRegistry donationRegistry;
    private final InviteIssuer inviteIssuer;
    private final TelegramSendPort telegramSendPort;
    private final TranslationPort translationPort;
    private final ClockPort clockPort;
    private final Map<String, AdminReviewSession> sessions = new ConcurrentHashMap<>();

    public AdminReviewConversation(NotifierSettings settings,
                                   DonationRegistry donationRegistry,
                                   InviteIssuer inviteIssuer,
                                   TelegramSendPort telegramSendPort,
                                   TranslationPort translationPort,
                                   ClockPort clockPort) {
        this.settings = settings;
        this.donationRegistry = donationRegistry;
        this.inviteIssuer = inviteIssuer;
        this.telegramSendPort = telegramSendPort;
        this.translationPort = translationPort;
        this.clockPort = clockPort;
    }

    /**
     * Opens a session over the currently unverified claims, replacing any session the admin had.
     */
    public void start(String adminChatId) {
        List<DonationClaim> pending = donationRegistry.listUnverified();
        if (pending.isEmpty()) {
            sessions.remove(adminChatId);
            reply(adminChatId, translationPort.t("review_none"));
            return;
        }
        sessions.put(adminChatId, AdminReviewSession.open(adminChatId, pending,
                clockPort.now().plus(settings.reviewSessionTtl())));
        reply(adminChatId, renderPending(pending));
    }

    public boolean isOpen(String adminChatId) {
        AdminReviewSession session = sessions.get(adminChatId);
        if (session == null) {
            return false;
        }
        if (session.isExpired(clockPort.now())) {
            sessions.remove(adminChatId);
            log.infof("Review session for %s expired", adminChatId);
            return false;
        }
        return true;
    }

    public void handle(String adminChatId, String text) {
        AdminReviewSession session = sessions.get(adminChatId);
        if (session == null) {
            return;
        }
        String input = text.trim();
        if (CANCEL.equalsIgnoreCase(input)) {
            sessions.remove(adminChatId);
            reply(adminChatId, translationPort.t("review_cancelled"));
            return;
        }
        switch (session.step()) {
            case SELECT -> handleSelect(session, input);
            case ACTION -> handleAction(session, input);
        }
    }

    private void handleSelect(AdminReviewSession session, String input) {
        List<DonationClaim> pending = session.pending();
        int index;
        try {
            index = Integer.parseInt(input);
        } catch (NumberFormatException e) {
            index = -1;
        }
        if (index < 1 || index > pending.size()) {
            reply(session.adminChatId(), translationPort.t("review_select_invalid", Map.of("max", pending.size())));
            return;
        }
        DonationClaim claim = pending.get(index - 1);
        sessions.put(session.adminChatId(), session.select(claim));
        reply(session.adminChatId(), translationPort.t("review_claim_detail", claimParams(claim)));
    }

    private void handleAction(AdminReviewSession session, String input) {
        if (VERIFY.equals(input)) {
            approve(session);
        } else if (REJECT.equals(input)) {
            reject(session);
        } else {
            reply(session.adminChatId(), translationPort.t("review_action_invalid"));
        }
    }

    private void approve(AdminReviewSession session) {
        String adminChatId = session.adminChatId();
        DonationClaim claim = session.selected();
        sessions.remove(adminChatId);
        if (!donationRegistry.setVerified(claim.chatId(), true)) {
            reply(adminChatId, translationPort.t("review_claim_gone", claimParams(claim)));
            return;
        }
        log.infof("Donation from %s verified by %s", claim.chatId(), adminChatId);
        reply(adminChatId, translationPort.t("review_verified_admin", claimParams(claim)));
        reply(claim.chatId(), translationPort.t("donate_verified_user"));
        settings.premiumDestination().ifPresent(premium -> inviteIssuer.issue(premium).ifPresentOrElse(
                link -> reply(claim.chatId(), translationPort.t("premium_invite_link", Map.of("link", link))),
                () -> reply(adminChatId, translationPort.t("premium_invite_failed", claimParams(claim)))));
    }

    private void reject(AdminReviewSession session) {
        String adminChatId = session.adminChatId();
        DonationClaim claim = session.selected();
        sessions.remove(adminChatId);
        if (!donationRegistry.remove(claim.chatId())) {
            reply(adminChatId, translationPort.t("review_claim_gone", claimParams(claim)));
            return;
        }
        log.infof("Donation from %s rejected by %s", claim.chatId(), adminChatId);
        reply(adminChatId, translationPort.t("review_rejected_admin", claimParams(claim)));
        reply(claim.chatId(), translationPort.t("donate_rejected_user"));
    }

    private String renderPending(List<DonationClaim> pending) {
        StringBuilder text = new StringBuilder(translationPort.t("review_pending_header",
                Map.of("count", pending.size())));
        text.append("\n");
        for (int i = 0; i < pending.size(); i++) {
            DonationClaim claim = pending.get(i);
            text.append("\n").append(i + 1).append(". ")
                    .append(HtmlText.escape(claim.displayName()))
                    .append(" (@").append(HtmlText.escape(claim.username())).append(") ")
                    .append("<code>").append(HtmlText.escape(claim.reference())).append("</code>");
        }
        text.append("\n\n").append(translationPort.t("review_select_prompt"));
        return text.toString();
    }

    private Map<String, Object> claimParams(DonationClaim claim) {
        return Map.of(
                "name", HtmlText.escape(claim.displayName()),
                "username", HtmlText.escape(claim.username()),
                "chat_id", claim.chatId(),
                "tx_id", HtmlText.escape(claim.reference()));
    }

    private void reply(String chatId, String text) {
        telegramSendPort.send(new TelegramOutgoingMessage(chatId, text));
    }
}
