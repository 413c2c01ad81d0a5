package com.ryuqq.tokenflow.testkit.contract;

import com.ryuqq.tokenflow.application.command.IllegalTransition;
import com.ryuqq.tokenflow.application.command.NotFound;
import com.ryuqq.tokenflow.application.command.StatusChanged;
import com.ryuqq.tokenflow.application.command.UpdateOutcome;
import com.ryuqq.tokenflow.application.registration.RegistrationOutcome;
import com.ryuqq.tokenflow.core.guard.DenialKind;
import com.ryuqq.tokenflow.core.model.StatusTransitionRecord;
import com.ryuqq.tokenflow.core.model.Token;
import com.ryuqq.tokenflow.core.model.TokenId;
import com.ryuqq.tokenflow.core.model.TokenStandard;
import com.ryuqq.tokenflow.core.statemachine.TokenStatus;
import com.ryuqq.tokenflow.core.workflow.WorkflowInfo;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Contract Test for the token life cycle.
 *
 * <p>This test validates that only transition table edges are applied through the
 * command, that terminal statuses stay terminal, and that denied requests leave the
 * token and its audit trail untouched.</p>
 *
 * <p><strong>Test Scenarios:</strong></p>
 * <ul>
 *   <li>DRAFT → UNDER_REVIEW: succeeds with one record</li>
 *   <li>DISTRIBUTED → DEPLOYED: IllegalTransition, nothing written</li>
 *   <li>DEPLOYED → PAUSED → DEPLOYED: two ordered records</li>
 *   <li>Workflow of an APPROVED token: [READY_TO_MINT, REJECTED]</li>
 *   <li>Full issuance path from registration to DISTRIBUTED</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class StateTransitionContractTest extends AbstractContractTest {

    @Test
    void testDraftToUnderReview_Succeeds() {
        // Given
        TokenId tokenId = createToken(TokenStatus.DRAFT);

        // When
        UpdateOutcome outcome = command.updateStatus(tokenId, TokenStatus.UNDER_REVIEW);

        // Then
        assertInstanceOf(StatusChanged.class, outcome);
        StatusChanged changed = (StatusChanged) outcome;
        assertEquals(TokenStatus.DRAFT, changed.previousStatus());
        assertEquals(TokenStatus.UNDER_REVIEW, changed.newStatus());
        assertTokenStatus(tokenId, TokenStatus.UNDER_REVIEW);
        assertHistorySize(tokenId, 1);
    }

    @Test
    void testDistributedToDeployed_IsRejected() {
        // Given
        TokenId tokenId = createToken(TokenStatus.DISTRIBUTED);
        Token before = loadToken(tokenId);

        // When
        UpdateOutcome outcome = command.updateStatus(tokenId, TokenStatus.DEPLOYED);

        // Then
        assertInstanceOf(IllegalTransition.class, outcome);
        IllegalTransition illegal = (IllegalTransition) outcome;
        assertEquals(DenialKind.ILLEGAL_TRANSITION, illegal.kind());
        assertTrue(illegal.reason().contains("terminal"), "Reason should mention terminal status: " + illegal.reason());
        assertFalse(illegal.isRetryable());
        assertUnchanged(before, 0);
    }

    @Test
    void testPauseAndResume_TwoOrderedRecords() {
        // Given
        TokenId tokenId = createToken(TokenStatus.DEPLOYED);

        // When
        transition(tokenId, TokenStatus.PAUSED);
        transition(tokenId, TokenStatus.DEPLOYED);

        // Then
        assertTokenStatus(tokenId, TokenStatus.DEPLOYED);
        List<StatusTransitionRecord> history = store.loadTransitionHistory(tokenId);
        assertEquals(2, history.size());
        assertEquals(TokenStatus.DEPLOYED, history.get(0).fromStatus());
        assertEquals(TokenStatus.PAUSED, history.get(0).toStatus());
        assertEquals(TokenStatus.PAUSED, history.get(1).fromStatus());
        assertEquals(TokenStatus.DEPLOYED, history.get(1).toStatus());
        assertTrue(history.get(0).occurredAt().isBefore(history.get(1).occurredAt()));
    }

    @Test
    void testApprovedWorkflow_OffersReadyToMintAndRejected() {
        // Given
        TokenId tokenId = createToken(TokenStatus.APPROVED);

        // When
        WorkflowInfo info = workflow.describe(loadToken(tokenId));

        // Then
        assertEquals(List.of(TokenStatus.READY_TO_MINT, TokenStatus.REJECTED), info.availableTransitions());
        assertTrue(info.canTransition());
        assertEquals("Approved", info.displayName());
    }

    @Test
    void testSameStatus_IsNoOpAndWritesNothing() {
        // Given
        TokenId tokenId = createToken(TokenStatus.MINTED);
        Token before = loadToken(tokenId);

        // When
        UpdateOutcome outcome = command.updateStatus(tokenId, TokenStatus.MINTED);

        // Then
        assertInstanceOf(IllegalTransition.class, outcome);
        assertEquals(DenialKind.NO_OP_TRANSITION, ((IllegalTransition) outcome).kind());
        assertUnchanged(before, 0);
    }

    @Test
    void testSkippingAStep_IsRejected() {
        // Given
        TokenId tokenId = createToken(TokenStatus.DRAFT);
        Token before = loadToken(tokenId);

        // When
        UpdateOutcome outcome = command.updateStatus(tokenId, TokenStatus.APPROVED);

        // Then
        assertInstanceOf(IllegalTransition.class, outcome);
        assertEquals(DenialKind.ILLEGAL_TRANSITION, ((IllegalTransition) outcome).kind());
        assertUnchanged(before, 0);
    }

    @Test
    void testUnknownToken_NotFound() {
        // When
        UpdateOutcome outcome = command.updateStatus(TokenId.of("TKN-MISSING"), TokenStatus.UNDER_REVIEW);

        // Then
        assertInstanceOf(NotFound.class, outcome);
        assertEquals(0, store.loadTransitionHistory(TokenId.of("TKN-MISSING")).size());
    }

    @Test
    void testFullIssuancePath_FromRegistrationToDistributed() {
        // Given
        TokenId tokenId = TokenId.of("BOND-2025-001");
        RegistrationOutcome registered = registration.registerDraft(
            tokenId, "Green Bond 2025", TokenStandard.ERC1400, Map.of("issuer", "ACME"));
        assertTrue(registered.isRegistered());
        assertHistorySize(tokenId, 0);

        List<TokenStatus> path = List.of(
            TokenStatus.UNDER_REVIEW,
            TokenStatus.APPROVED,
            TokenStatus.READY_TO_MINT,
            TokenStatus.MINTED,
            TokenStatus.DEPLOYED,
            TokenStatus.DISTRIBUTED
        );

        // When
        for (TokenStatus next : path) {
            transition(tokenId, next);
        }

        // Then
        assertTokenStatus(tokenId, TokenStatus.DISTRIBUTED);
        List<StatusTransitionRecord> history = store.loadTransitionHistory(tokenId);
        assertEquals(path.size(), history.size());
        TokenStatus previous = TokenStatus.DRAFT;
        for (int i = 0; i < path.size(); i++) {
            assertEquals(previous, history.get(i).fromStatus());
            assertEquals(path.get(i), history.get(i).toStatus());
            previous = path.get(i);
        }

        WorkflowInfo info = workflow.describe(loadToken(tokenId));
        assertFalse(info.canTransition());
        assertTrue(info.isTerminal());
        assertEquals("ACME", loadToken(tokenId).attributeOrNull("issuer"));
    }

    @Test
    void testRejectedFromReview_IsTerminal() {
        // Given
        TokenId tokenId = createToken(TokenStatus.UNDER_REVIEW);
        transition(tokenId, TokenStatus.REJECTED);

        // When
        UpdateOutcome outcome = command.updateStatus(tokenId, TokenStatus.UNDER_REVIEW);

        // Then
        assertInstanceOf(IllegalTransition.class, outcome);
        assertTokenStatus(tokenId, TokenStatus.REJECTED);
        assertHistorySize(tokenId, 1);
    }
}
