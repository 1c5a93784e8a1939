package org.dazzle.engine.guard;

import org.dazzle.dsl.DslParser;
import org.dazzle.dsl.definition.StateMachine;
import org.dazzle.engine.guard.TransitionError.GuardNotSatisfied;
import org.dazzle.engine.guard.TransitionError.GuardType;
import org.dazzle.engine.guard.TransitionError.InvalidTransition;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

public class TransitionValidatorTest {

    private static StateMachine stateMachine(String source) {
        return DslParser.parse(source).fragment().entities().get(0).stateMachine();
    }

    private static final StateMachine TICKET = stateMachine("""
            entity Ticket:
              id: uuid pk
              status: enum[open,assigned,resolved,closed]
              assignee: str
              resolution: text
              transitions:
                open -> assigned: requires assignee
                assigned -> resolved: requires resolution role(agent)
                resolved -> closed: auto after 7 days or manual
                * -> open: role(admin)
            """);

    private static final StateMachine RETURN = stateMachine("""
            entity Return:
              id: uuid pk
              status: enum[requested,inspected,refunded]
              photos_checked: bool
              receipt_checked: bool
              refund_amount: decimal(10,2)
              transitions:
                requested -> inspected:
                  guard: all_true(photos_checked, receipt_checked)
                inspected -> refunded:
                  guard: refund_amount > 0 and current_user.can_refund
                    message: "Refund needs a positive amount and an authorized user"
                refunded -> requested:
                  guard: refund_amount == 0
            """);

    private static final StateMachine PAYOUT = stateMachine("""
            entity Payout:
              id: uuid pk
              status: enum[pending,approved,paid]
              amount: decimal(12,2)
              memo: str
              transitions:
                pending -> approved:
                  guard: round(amount) > 0
                approved -> paid:
                  guard: memo == "say \\"ok\\""
            """);

    private final TransitionValidator tickets = new TransitionValidator(TICKET);
    private final TransitionValidator returns = new TransitionValidator(RETURN);
    private final TransitionValidator payouts = new TransitionValidator(PAYOUT);

    @Nested
    @DisplayName("State graph")
    class StateGraph {

        @Test
        @DisplayName("Declared transition with satisfied guard is allowed")
        void testAllowed() {
            TransitionResult result = tickets.validateTransition("open", "assigned", Map.of("assignee", "alice"));

            assertTrue(result.valid());
            assertNull(result.error());
            assertEquals("assigned", result.transition().toState());
        }

        @Test
        @DisplayName("Undeclared transition lists the reachable states")
        void testInvalidTransition() {
            TransitionResult result = tickets.validateTransition("open", "closed", Map.of());

            assertFalse(result.valid());
            InvalidTransition error = assertInstanceOf(InvalidTransition.class, result.error());
            assertEquals(List.of("assigned", "open"), error.allowedStates());
            assertEquals("Cannot transition from 'open' to 'closed'. Allowed transitions: assigned, open",
                    result.errorMessage());
        }

        @Test
        @DisplayName("Wildcard transition matches any source state")
        void testWildcard() {
            TransitionResult result = tickets.validateTransition("closed", "open", Map.of(), List.of("admin"), null);

            assertTrue(result.valid());
            assertTrue(result.transition().isWildcard());
        }

        @Test
        @DisplayName("Staying in the same state is always allowed")
        void testSameState() {
            assertTrue(tickets.validateTransition("resolved", "resolved", Map.of()).valid());
        }

        @Test
        @DisplayName("Record without a state may start in any legal state")
        void testInitialState() {
            assertTrue(tickets.validateTransition(null, "assigned", Map.of()).valid());

            TransitionResult bogus = tickets.validateTransition(null, "bogus", Map.of());
            assertFalse(bogus.valid());
            assertEquals("Cannot transition from 'null' to 'bogus'. Allowed transitions: open, assigned, resolved, closed",
                    bogus.errorMessage());
        }

        @Test
        @DisplayName("Terminal state without outgoing transitions reports none")
        void testNoOutgoingTransitions() {
            StateMachine oneWay = stateMachine("""
                    entity Job:
                      status: enum[queued,done]
                      transitions:
                        queued -> done
                    """);

            TransitionResult result = new TransitionValidator(oneWay).validateTransition("done", "queued", Map.of());

            assertEquals("Cannot transition from 'done' to 'queued'. Allowed transitions: none", result.errorMessage());
        }
    }

    @Nested
    @DisplayName("Field and role guards")
    class FieldAndRoleGuards {

        @Test
        @DisplayName("Missing or blank required field fails")
        void testRequiresField() {
            Map<String, Object> data = new HashMap<>();
            data.put("assignee", null);

            TransitionResult missing = tickets.validateTransition("open", "assigned", data);
            TransitionResult blank = tickets.validateTransition("open", "assigned", Map.of("assignee", "  "));

            GuardNotSatisfied error = assertInstanceOf(GuardNotSatisfied.class, missing.error());
            assertEquals(GuardType.REQUIRES, error.guardType());
            assertEquals("assignee", error.guardValue());
            assertEquals("Field 'assignee' is required for transition 'open' -> 'assigned'", error.message());
            assertFalse(blank.valid());
        }

        @Test
        @DisplayName("Role guard fails without the role")
        void testRoleGuard() {
            Map<String, Object> data = Map.of("resolution", "fixed");

            TransitionResult denied = tickets.validateTransition("assigned", "resolved", data, List.of("viewer"), null);
            TransitionResult granted = tickets.validateTransition("assigned", "resolved", data, List.of("agent"), null);

            GuardNotSatisfied error = assertInstanceOf(GuardNotSatisfied.class, denied.error());
            assertEquals(GuardType.ROLE, error.guardType());
            assertEquals("Role 'agent' is required for transition 'assigned' -> 'resolved'", error.message());
            assertTrue(granted.valid());
        }

        @Test
        @DisplayName("Null roles skip role guards")
        void testNullRolesSkipRoleGuard() {
            assertTrue(tickets.validateTransition("assigned", "resolved", Map.of("resolution", "fixed")).valid());
        }

        @Test
        @DisplayName("Guards are checked in order and the first failure is reported")
        void testFirstFailureReported() {
            TransitionResult result = tickets.validateTransition("assigned", "resolved", Map.of(), List.of(), null);

            GuardNotSatisfied error = assertInstanceOf(GuardNotSatisfied.class, result.error());
            assertEquals(GuardType.REQUIRES, error.guardType());
        }
    }

    @Nested
    @DisplayName("Expression guards")
    class ExpressionGuards {

        @Test
        @DisplayName("Incomplete checklist names the unchecked items")
        void testChecklistMessage() {
            TransitionResult result = returns.validateTransition("requested", "inspected",
                    Map.of("photos_checked", true, "receipt_checked", false));

            GuardNotSatisfied error = assertInstanceOf(GuardNotSatisfied.class, result.error());
            assertEquals(GuardType.EXPRESSION, error.guardType());
            assertEquals("all_true(photos_checked, receipt_checked)", error.guardValue());
            assertEquals("Checklist incomplete. Unchecked items: receipt_checked", error.message());
        }

        @Test
        @DisplayName("Complete checklist passes")
        void testChecklistComplete() {
            assertTrue(returns.validateTransition("requested", "inspected",
                    Map.of("photos_checked", true, "receipt_checked", true)).valid());
        }

        @Test
        @DisplayName("current_user is bound for guard expressions")
        void testCurrentUser() {
            Map<String, Object> data = Map.of("refund_amount", 25.0);

            TransitionResult allowed = returns.validateTransition("inspected", "refunded", data,
                    null, Map.of("can_refund", true));
            TransitionResult anonymous = returns.validateTransition("inspected", "refunded", data);

            assertTrue(allowed.valid());
            assertFalse(anonymous.valid());
            assertEquals("Refund needs a positive amount and an authorized user", anonymous.errorMessage());
        }

        @Test
        @DisplayName("Evaluation error counts as a failed guard")
        void testEvaluationErrorFailsGuard() {
            TransitionResult result = returns.validateTransition("inspected", "refunded",
                    Map.of("refund_amount", "lots"), null, Map.of("can_refund", true));

            assertFalse(result.valid());
            assertEquals("Refund needs a positive amount and an authorized user", result.errorMessage());
        }

        @Test
        @DisplayName("Out-of-range numbers fail the guard instead of escaping")
        void testNumericFaultFailsGuard() {
            assertTrue(payouts.validateTransition("pending", "approved", Map.of("amount", 12.4)).valid());

            TransitionResult huge = payouts.validateTransition("pending", "approved", Map.of("amount", 1e30));
            TransitionResult nan = payouts.validateTransition("pending", "approved", Map.of("amount", Double.NaN));

            assertFalse(huge.valid());
            assertEquals(TransitionValidator.DEFAULT_GUARD_MESSAGE, huge.errorMessage());
            assertFalse(nan.valid());
        }

        @Test
        @DisplayName("Guard value keeps quotes inside string literals escaped")
        void testQuotedGuardValue() {
            assertTrue(payouts.validateTransition("approved", "paid", Map.of("memo", "say \"ok\"")).valid());

            TransitionResult result = payouts.validateTransition("approved", "paid", Map.of("memo", "nope"));

            GuardNotSatisfied error = assertInstanceOf(GuardNotSatisfied.class, result.error());
            assertEquals("(memo == \"say \\\"ok\\\"\")", error.guardValue());
        }

        @Test
        @DisplayName("Guard without message gets the generic one")
        void testDefaultMessage() {
            TransitionResult result = returns.validateTransition("refunded", "requested", Map.of("refund_amount", 10.0));

            assertEquals(TransitionValidator.DEFAULT_GUARD_MESSAGE, result.errorMessage());
        }
    }

    @Nested
    @DisplayName("Status updates")
    class StatusUpdates {

        @Test
        @DisplayName("Guards see the current record merged with the update")
        void testMergedUpdate() {
            Map<String, Object> current = new HashMap<>();
            current.put("status", "open");
            current.put("assignee", null);

            Optional<TransitionResult> result = tickets.validateStatusUpdate(current,
                    Map.of("status", "assigned", "assignee", "bob"));

            assertTrue(result.isPresent());
            assertTrue(result.get().valid());
        }

        @Test
        @DisplayName("Update that leaves the status alone is not a transition")
        void testNoStatusChange() {
            Map<String, Object> current = Map.of("status", "open");

            assertTrue(tickets.validateStatusUpdate(current, Map.of("assignee", "bob")).isEmpty());
            assertTrue(tickets.validateStatusUpdate(current, Map.of("status", "open")).isEmpty());
        }

        @Test
        @DisplayName("Rejected status update carries the error")
        void testRejectedUpdate() {
            Optional<TransitionResult> result = tickets.validateStatusUpdate(Map.of("status", "open"),
                    Map.of("status", "resolved"));

            assertFalse(result.orElseThrow().valid());
            assertInstanceOf(InvalidTransition.class, result.orElseThrow().error());
        }
    }
}
