package com.my.seatbot.domain.service;

import com.my.seatbot.adapter.out.persistence.InMemoryRecordStore;
import com.my.seatbot.domain.model.ChatUser;
import com.my.seatbot.domain.model.IncomingUpdate;
import com.my.seatbot.domain.model.NotifierSettings;
import com.my.seatbot.domain.model.Subscriber;
import com.my.seatbot.domain.model.TelegramOutgoingMessage;
import com.my.seatbot.domain.port.out.TelegramSendPort;
import com.my.seatbot.support.Fixtures;
import com.my.seatbot.support.KeyTranslations;
import com.my.seatbot.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.List;
import java.util.Optional;

import static com.my.seatbot.support.Fixtures.ADMIN;
import static com.my.seatbot.support.Fixtures.user;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.atLeast;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class UpdateDispatcherTest {

    private static final String ALICE = "101";

    private TelegramSendPort sendPort;
    private StarVerificationService stars;
    private MembershipEnforcer enforcer;
    private SubscriberRegistry subscribers;
    private DonationRegistry donations;
    private UpdateDispatcher dispatcher;
    private long nextUpdateId = 1;

    @BeforeEach
    void setUp() {
        sendPort = mock(TelegramSendPort.class);
        when(sendPort.send(any())).thenReturn(true);
        stars = mock(StarVerificationService.class);
        enforcer = mock(MembershipEnforcer.class);
        MutableClock clock = new MutableClock();
        NotifierSettings settings = Fixtures.settings(false);
        subscribers = new SubscriberRegistry(new InMemoryRecordStore<>(), clock);
        donations = new DonationRegistry(new InMemoryRecordStore<>(), clock);
        InviteIssuer inviteIssuer = new InviteIssuer(sendPort, clock);
        AdminReviewConversation conversation = new AdminReviewConversation(settings, donations, inviteIssuer,
                sendPort, new KeyTranslations(), clock);
        dispatcher = new UpdateDispatcher(settings, subscribers, donations, stars, conversation, enforcer,
                inviteIssuer, sendPort, new KeyTranslations());
    }

    @Test
    void start_subscribes_and_welcomes() {
        send(ALICE, "/start@SeatBot");

        assertThat(subscribers.get(ALICE)).map(Subscriber::active).contains(true);
        assertThat(repliesTo(ALICE)).containsExactly("bot_welcome{repo=" + Fixtures.REPO + "}");
    }

    @Test
    void unverified_sender_hits_the_gate() {
        send(ALICE, "/start");

        send(ALICE, "/exam");
        send(ALICE, "/status");

        assertThat(repliesTo(ALICE)).filteredOn(text -> text.startsWith("github_required")).hasSize(2);
    }

    @Test
    void identity_command_verifies_starred_account() {
        when(stars.hasEndorsed("Octocat")).thenReturn(true);

        send(ALICE, "/github https://github.com/Octocat/");

        Subscriber subscriber = subscribers.get(ALICE).orElseThrow();
        assertThat(subscriber.isVerifiedAndActive()).isTrue();
        assertThat(subscriber.githubUsername()).isEqualTo("Octocat");
        assertThat(repliesTo(ALICE)).containsExactly(
                "github_checking{username=Octocat}",
                "github_verified{username=Octocat}");
    }

    @Test
    void identity_command_rejects_account_without_star() {
        when(stars.hasEndorsed("nobody")).thenReturn(false);

        send(ALICE, "/star @nobody");

        assertThat(subscribers.get(ALICE)).isEmpty();
        assertThat(last(repliesTo(ALICE))).isEqualTo(
                "github_not_starred{repo=" + Fixtures.REPO + ", username=nobody}");
    }

    @Test
    void identity_already_held_elsewhere_is_refused() {
        when(stars.hasEndorsed(anyString())).thenReturn(true);
        send("202", "/github octocat");

        send(ALICE, "/github OCTOCAT");

        assertThat(subscribers.get(ALICE)).isEmpty();
        assertThat(last(repliesTo(ALICE))).isEqualTo("github_already_claimed{username=OCTOCAT}");
    }

    @Test
    void refused_identity_leaves_opted_out_sender_inactive() {
        when(stars.hasEndorsed(anyString())).thenReturn(true);
        send("202", "/github octocat");
        subscribers.subscribe(ALICE, user(101, "alice"));
        subscribers.unsubscribe(ALICE);
        Subscriber before = subscribers.get(ALICE).orElseThrow();

        send(ALICE, "/github octocat");

        assertThat(subscribers.get(ALICE)).contains(before);
        assertThat(before.active()).isFalse();
        assertThat(last(repliesTo(ALICE))).isEqualTo("github_already_claimed{username=octocat}");
    }

    @Test
    void verified_identity_reactivates_opted_out_sender() {
        when(stars.hasEndorsed("octocat")).thenReturn(true);
        subscribers.subscribe(ALICE, user(101, "alice"));
        subscribers.unsubscribe(ALICE);

        send(ALICE, "/github octocat");

        assertThat(subscribers.get(ALICE)).map(Subscriber::isVerifiedAndActive).contains(true);
    }

    @Test
    void identity_command_without_argument_shows_usage() {
        send(ALICE, "/github");
        send(ALICE, "/github @/");

        assertThat(repliesTo(ALICE)).containsExactly("github_usage", "github_usage");
        verifyNoInteractions(stars);
    }

    @Test
    void donate_without_argument_shows_address() {
        send(ALICE, "/donate");

        assertThat(repliesTo(ALICE)).containsExactly("donate_info{address=TXaddress}");
    }

    @Test
    void overlong_donation_reference_is_refused() {
        send(ALICE, "/donate " + "x".repeat(UpdateDispatcher.MAX_REFERENCE_LENGTH + 1));

        assertThat(repliesTo(ALICE)).containsExactly("donate_invalid_ref{max=128}");
        assertThat(donations.get(ALICE)).isEmpty();
    }

    @Test
    void free_form_donation_reference_is_stored_and_escaped_in_replies() {
        send(ALICE, "/donate paid 5 USDT <tx>");

        assertThat(donations.get(ALICE)).map(claim -> claim.reference()).contains("paid 5 USDT <tx>");
        assertThat(repliesTo(ALICE)).containsExactly("donate_submitted{tx_id=paid 5 USDT &lt;tx&gt;}");
    }

    @Test
    void donation_claim_is_stored_and_forwarded_to_admin() {
        send(ALICE, "/donate abc123_DEF-456");

        assertThat(donations.get(ALICE)).map(claim -> claim.reference()).contains("abc123_DEF-456");
        assertThat(repliesTo(ALICE)).containsExactly("donate_submitted{tx_id=abc123_DEF-456}");
        assertThat(repliesTo(ADMIN)).hasSize(1);
        assertThat(last(repliesTo(ADMIN))).startsWith("donate_admin_notice").contains("chat_id=" + ALICE);
    }

    @Test
    void ordinal_selection_sends_fresh_invite_for_that_topic() {
        verifiedSubscriber(ALICE);
        when(sendPort.createInviteLink(eq("-100111"), anyLong(), eq(1))).thenReturn(Optional.of("https://t.me/+x"));

        // topics are sorted: CEnT-S, TOLC-E, TOLC-I
        send(ALICE, "3");

        assertThat(repliesTo(ALICE)).endsWith(
                "invite_generating{exam=TOLC-I}",
                "invite_link{exam=TOLC-I, link=https://t.me/+x}");
    }

    @Test
    void topic_name_selection_is_case_insensitive() {
        verifiedSubscriber(ALICE);
        when(sendPort.createInviteLink(anyString(), anyLong(), anyInt())).thenReturn(Optional.empty());

        send(ALICE, "tolc-e");

        assertThat(last(repliesTo(ALICE))).isEqualTo("invite_failed{exam=TOLC-E}");
    }

    @Test
    void topic_without_group_reports_missing_group() {
        verifiedSubscriber(ALICE);

        send(ALICE, "1");

        assertThat(last(repliesTo(ALICE))).isEqualTo("invite_group_missing{exam=CEnT-S}");
        verify(sendPort, never()).createInviteLink(anyString(), anyLong(), anyInt());
    }

    @Test
    void unrecognised_text_from_verified_subscriber_is_ignored() {
        verifiedSubscriber(ALICE);
        int before = repliesTo(ALICE).size();

        send(ALICE, "hello there");
        send(ALICE, "42");

        assertThat(repliesTo(ALICE)).hasSize(before);
    }

    @Test
    void alerts_command_updates_preferences() {
        verifiedSubscriber(ALICE);

        send(ALICE, "/alerts tolc-i, TOLC-E tolc-i");
        assertThat(subscribers.get(ALICE).orElseThrow().exams()).containsExactly("TOLC-I", "TOLC-E");

        send(ALICE, "/alerts all");
        assertThat(subscribers.get(ALICE).orElseThrow().exams()).containsExactly(Subscriber.ALL_TOPICS);

        send(ALICE, "/alerts none");
        assertThat(subscribers.get(ALICE).orElseThrow().exams()).isEmpty();

        send(ALICE, "/alerts TOLC-X");
        assertThat(last(repliesTo(ALICE))).startsWith("alerts_invalid");
    }

    @Test
    void status_reports_donation_state() {
        verifiedSubscriber(ALICE);
        donations.addClaim(ALICE, user(101, "alice"), "pending-ref-1");

        send(ALICE, "/status");

        assertThat(last(repliesTo(ALICE)))
                .startsWith("status_message")
                .contains("donation=status_pending")
                .contains("github=alice-gh")
                .contains("exams=alerts_none");
    }

    @Test
    void stop_deactivates_subscriber() {
        verifiedSubscriber(ALICE);

        send(ALICE, "/stop");

        assertThat(subscribers.get(ALICE).orElseThrow().active()).isFalse();
        assertThat(last(repliesTo(ALICE))).isEqualTo("bot_stopped");
    }

    @Test
    void admin_commands_are_hidden_from_others() {
        verifiedSubscriber(ALICE);

        send(ALICE, "/stats");
        send(ALICE, "/donations");

        assertThat(repliesTo(ALICE)).noneMatch(text -> text.startsWith("admin_stats") || text.startsWith("review_"));
    }

    @Test
    void admin_stats_counts_registries() {
        verifiedSubscriber(ALICE);
        donations.addClaim("303", user(303, "c"), "pending-ref-1");
        when(stars.getEndorserCount()).thenReturn(17);

        send(ADMIN, "/stats");

        assertThat(repliesTo(ADMIN)).containsExactly(
                "admin_stats{active=1, pending=1, premium=0, stars=17, verified=1}");
    }

    @Test
    void admin_interval_validates_range() {
        send(ADMIN, "/start");

        send(ADMIN, "/interval");
        send(ADMIN, "/interval soon");
        send(ADMIN, "/interval 0");
        send(ADMIN, "/interval 61");
        send(ADMIN, "/interval 5");

        assertThat(repliesTo(ADMIN)).endsWith(
                "interval_info", "interval_usage", "interval_range", "interval_range", "interval_set{minutes=5}");
        assertThat(subscribers.get(ADMIN).orElseThrow().intervalMinutes()).isEqualTo(5);
    }

    @Test
    void open_review_session_takes_admin_messages() {
        donations.addClaim(ALICE, user(101, "alice"), "claim-ref-01");

        send(ADMIN, "/donations");
        send(ADMIN, "1");
        send(ADMIN, "2");

        assertThat(donations.get(ALICE)).isEmpty();
        assertThat(repliesTo(ALICE)).containsExactly("donate_rejected_user");
    }

    @Test
    void membership_changes_go_to_enforcer() {
        List<ChatUser> joined = List.of(user(5, "new"));

        dispatcher.handle(new IncomingUpdate(nextUpdateId++, "-100111", "supergroup", user(5, "new"), null, joined));

        verify(enforcer).onMembersJoined("-100111", joined);
        verifyNoInteractions(sendPort);
    }

    @Test
    void group_text_and_empty_updates_are_ignored() {
        dispatcher.handle(new IncomingUpdate(nextUpdateId++, "-100111", "group", user(5, "x"), "/start", List.of()));
        dispatcher.handle(new IncomingUpdate(nextUpdateId++, "", null, null, null, List.of()));
        dispatcher.handle(new IncomingUpdate(nextUpdateId++, ALICE, "private", user(101, "a"), "   ", List.of()));

        verifyNoInteractions(sendPort, enforcer);
        assertThat(subscribers.listAll()).isEmpty();
    }

    @Test
    void identity_normalisation_accepts_common_forms() {
        assertThat(UpdateDispatcher.normalizeIdentity("@octocat")).isEqualTo("octocat");
        assertThat(UpdateDispatcher.normalizeIdentity("octocat/")).isEqualTo("octocat");
        assertThat(UpdateDispatcher.normalizeIdentity("https://github.com/octocat")).isEqualTo("octocat");
        assertThat(UpdateDispatcher.normalizeIdentity("github.com/octocat/")).isEqualTo("octocat");
        assertThat(UpdateDispatcher.normalizeIdentity(" @/ ")).isEmpty();
    }

    private void verifiedSubscriber(String chatId) {
        subscribers.subscribe(chatId, user(Long.parseLong(chatId), "alice"));
        subscribers.setVerifiedIdentity(chatId, "alice-gh");
    }

    private void send(String chatId, String text) {
        dispatcher.handle(new IncomingUpdate(nextUpdateId++, chatId, "private",
                user(Long.parseLong(chatId), "alice"), text, List.of()));
    }

    private List<String> repliesTo(String chatId) {
        ArgumentCaptor<TelegramOutgoingMessage> captor = ArgumentCaptor.forClass(TelegramOutgoingMessage.class);
        verify(sendPort, atLeast(0)).send(captor.capture());
        return captor.getAllValues().stream()
                .filter(message -> message.chatId().equals(chatId))
                .map(TelegramOutgoingMessage::text)
                .toList();
    }

    private static String last(List<String> texts) {
        assertThat(texts).isNotEmpty();
        return texts.get(texts.size() - 1);
    }
}
