package ai.pipestream.workspace.access;

import ai.pipestream.workspace.error.CycleException;
import ai.pipestream.workspace.error.ErrorCategory;
import ai.pipestream.workspace.error.NodeNotFoundException;
import ai.pipestream.workspace.error.PermissionDeniedException;
import ai.pipestream.workspace.grant.Grant;
import ai.pipestream.workspace.identity.Identity;
import ai.pipestream.workspace.node.Node;
import ai.pipestream.workspace.node.NodeStore;
import ai.pipestream.workspace.node.NodeType;
import ai.pipestream.workspace.permission.PermissionLevel;
import io.quarkus.test.junit.QuarkusTest;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the access gateway: decisions, guarded mutations, hidden nodes and
 * concurrent moves.
 */
@QuarkusTest
class AccessGatewayTest {

    private static final Logger LOG = Logger.getLogger(AccessGatewayTest.class);

    @Inject
    AccessGateway gateway;

    @Inject
    NodeStore nodeStore;

    @Inject
    AccessMetrics metrics;

    private Identity owner;
    private Identity collaborator;
    private Node workspace;
    private Node document;

    @BeforeEach
    void setUp() {
        owner = Identity.nativeUser("owner-" + UUID.randomUUID());
        collaborator = Identity.federated("collab-" + UUID.randomUUID(), "github");
        workspace = gateway.createWorkspace(owner, "Team");
        document = gateway.createChild(owner, workspace.id(), NodeType.DOCUMENT, "plan.md");
    }

    @Test
    void testAuthorizeReturnsNodeSnapshot() {
        gateway.share(owner, workspace.id(), collaborator.userId(), PermissionLevel.COMMENT);

        Authorization authorization = gateway.authorize(collaborator, document.id(), PermissionLevel.READ, NodeAction.READ);

        assertEquals(document, authorization.node());
        assertEquals(workspace.id(), authorization.workspaceId());
        assertEquals(PermissionLevel.COMMENT, authorization.effectiveLevel());
        assertEquals(NodeAction.READ, authorization.action());
        assertTrue(authorization.permits(PermissionLevel.COMMENT));
        assertFalse(authorization.permits(PermissionLevel.EDIT));
    }

    @Test
    void testDeniedEditLeavesStoreUntouched() {
        gateway.share(owner, document.id(), collaborator.userId(), PermissionLevel.COMMENT);
        Node before = nodeStore.get(document.id());
        long countBefore = nodeStore.count();
        double deniedBefore = metrics.decisionCount(NodeAction.RENAME, "denied");

        PermissionDeniedException error = assertThrows(PermissionDeniedException.class,
                () -> gateway.guarded(collaborator, document.id(), PermissionLevel.EDIT, NodeAction.RENAME,
                        auth -> nodeStore.rename(auth, "hijacked.md")));
        assertEquals(ErrorCategory.PERMISSION_DENIED, error.category());

        assertThrows(PermissionDeniedException.class,
                () -> gateway.rename(collaborator, document.id(), "hijacked.md"));
        assertThrows(PermissionDeniedException.class,
                () -> gateway.createChild(collaborator, document.id(), NodeType.RESOURCE, "attachment.bin"));
        assertThrows(PermissionDeniedException.class,
                () -> gateway.softDelete(collaborator, document.id()));

        assertEquals(before, nodeStore.get(document.id()));
        assertEquals(countBefore, nodeStore.count());
        assertThat(metrics.decisionCount(NodeAction.RENAME, "denied"), is(deniedBefore + 2));
    }

    @Test
    void testEditorCanMutateAndOwnsWhatTheyCreate() {
        gateway.share(owner, workspace.id(), collaborator.userId(), PermissionLevel.EDIT);

        Node renamed = gateway.rename(collaborator, document.id(), "plan-v2.md");
        Node created = gateway.createChild(collaborator, workspace.id(), NodeType.CATEGORY, "Notes");

        assertEquals("plan-v2.md", renamed.name());
        assertEquals(collaborator.userId(), created.ownerId());
        assertEquals(PermissionLevel.OWNER,
                gateway.authorize(collaborator, created.id(), PermissionLevel.OWNER, NodeAction.DELETE).effectiveLevel());
        // the workspace owner holds no grant on the collaborator's node
        assertThrows(PermissionDeniedException.class, () -> gateway.read(owner, created.id()));
    }

    @Test
    void testMissingAndHiddenNodesAreIndistinguishable() {
        long missing = Long.MAX_VALUE - 100;

        PermissionDeniedException onMissing = assertThrows(PermissionDeniedException.class,
                () -> gateway.read(collaborator, missing));
        PermissionDeniedException onHidden = assertThrows(PermissionDeniedException.class,
                () -> gateway.read(collaborator, document.id()));

        assertEquals(onMissing.category(), onHidden.category());
        assertEquals(onMissing.getMessage().replace(String.valueOf(missing), "#"),
                onHidden.getMessage().replace(String.valueOf(document.id()), "#"));
    }

    @Test
    void testSoftDeletedSubtreeIsOwnerOnly() {
        Node category = gateway.createChild(owner, workspace.id(), NodeType.CATEGORY, "Old");
        Node nested = gateway.createChild(owner, category.id(), NodeType.DOCUMENT, "nested.md");
        gateway.share(owner, workspace.id(), collaborator.userId(), PermissionLevel.EDIT);

        assertThrows(PermissionDeniedException.class, () -> gateway.softDelete(collaborator, category.id()));
        Node deleted = gateway.softDelete(owner, category.id());
        assertTrue(deleted.isDeleted());

        assertThrows(PermissionDeniedException.class, () -> gateway.read(collaborator, category.id()));
        assertThrows(PermissionDeniedException.class, () -> gateway.read(collaborator, nested.id()));
        assertEquals(nested, gateway.read(owner, nested.id()));

        assertThat(toList(gateway.listChildren(collaborator, workspace.id())), not(hasItem(deleted)));
        assertThat(toList(gateway.listAllChildren(owner, workspace.id())), hasItem(deleted));
        assertThrows(PermissionDeniedException.class, () -> gateway.listAllChildren(collaborator, workspace.id()));

        gateway.restore(owner, category.id());
        assertEquals(nested, gateway.read(collaborator, nested.id()));
    }

    @Test
    void testMoveRequiresEditOnBothEnds() {
        Node source = gateway.createChild(owner, workspace.id(), NodeType.CATEGORY, "Source");
        Node target = gateway.createChild(owner, workspace.id(), NodeType.CATEGORY, "Target");
        Node item = gateway.createChild(owner, source.id(), NodeType.DOCUMENT, "item.md");
        gateway.share(owner, source.id(), collaborator.userId(), PermissionLevel.EDIT);
        gateway.share(owner, target.id(), collaborator.userId(), PermissionLevel.READ);

        assertThrows(PermissionDeniedException.class, () -> gateway.move(collaborator, item.id(), target.id()));
        assertThat(nodeStore.get(item.id()).parentId(), is(source.id()));

        gateway.share(owner, target.id(), collaborator.userId(), PermissionLevel.EDIT);
        Node moved = gateway.move(collaborator, item.id(), target.id());

        assertThat(moved.parentId(), is(target.id()));
    }

    @Test
    void testChildListingStopsAfterAccessIsRevoked() {
        gateway.share(owner, workspace.id(), collaborator.userId(), PermissionLevel.READ);
        Iterable<Node> children = gateway.listChildren(collaborator, workspace.id());
        assertThat(toList(children), contains(document));

        gateway.revokeShare(owner, workspace.id(), collaborator.userId());
        gateway.createChild(owner, workspace.id(), NodeType.DOCUMENT, "secret-after-revoke.md");

        assertThrows(PermissionDeniedException.class, () -> toList(children));
        assertThat(toList(gateway.listChildren(owner, workspace.id())), hasSize(2));
    }

    @Test
    void testMoveIntoMissingDestinationIsNotFound() {
        Node category = gateway.createChild(owner, workspace.id(), NodeType.CATEGORY, "Drafts");
        long missing = Long.MAX_VALUE - 200;

        NodeNotFoundException error = assertThrows(NodeNotFoundException.class,
                () -> gateway.move(owner, category.id(), missing));
        assertEquals(ErrorCategory.NOT_FOUND, error.category());
        assertThat(nodeStore.get(category.id()).parentId(), is(workspace.id()));
    }

    @Test
    void testMoveByUnauthorizedCallerIsDeniedEvenForMissingDestination() {
        long missing = Long.MAX_VALUE - 201;

        assertThrows(PermissionDeniedException.class, () -> gateway.move(collaborator, document.id(), missing));
        assertThrows(PermissionDeniedException.class, () -> gateway.move(collaborator, missing, workspace.id()));
    }

    @Test
    void testSharingIsOwnerOnly() {
        gateway.share(owner, workspace.id(), collaborator.userId(), PermissionLevel.EDIT);

        assertThrows(PermissionDeniedException.class,
                () -> gateway.share(collaborator, document.id(), "someone-else", PermissionLevel.READ));

        Grant grant = gateway.share(owner, document.id(), "someone-else", PermissionLevel.READ);
        assertThat(gateway.listGrants(owner, document.id()), contains(grant));

        gateway.revokeShare(owner, document.id(), "someone-else");
        assertThat(gateway.listGrants(owner, document.id()), is(empty()));
        assertThrows(PermissionDeniedException.class,
                () -> gateway.read(Identity.nativeUser("someone-else"), document.id()));
    }

    @Test
    void testListEffectivePermissionsIsOwnerOnly() {
        gateway.share(owner, workspace.id(), collaborator.userId(), PermissionLevel.READ);

        Map<String, PermissionLevel> levels = gateway.listEffectivePermissions(owner, document.id());

        assertThat(levels, hasEntry(owner.userId(), PermissionLevel.OWNER));
        assertThat(levels, hasEntry(collaborator.userId(), PermissionLevel.READ));
        assertThrows(PermissionDeniedException.class,
                () -> gateway.listEffectivePermissions(collaborator, document.id()));
    }

    @Test
    void testConcurrentOpposingMovesYieldExactlyOneSuccess() throws Exception {
        ExecutorService executor = Executors.newFixedThreadPool(2);
        try {
            for (int round = 0; round < 50; round++) {
                Node a = gateway.createChild(owner, workspace.id(), NodeType.CATEGORY, "A" + round);
                Node b = gateway.createChild(owner, workspace.id(), NodeType.CATEGORY, "B" + round);
                CountDownLatch start = new CountDownLatch(1);

                Future<Boolean> aUnderB = executor.submit(() -> attemptMove(start, a.id(), b.id()));
                Future<Boolean> bUnderA = executor.submit(() -> attemptMove(start, b.id(), a.id()));
                start.countDown();

                boolean first = aUnderB.get(10, TimeUnit.SECONDS);
                boolean second = bUnderA.get(10, TimeUnit.SECONDS);

                assertTrue(first ^ second, "exactly one of the opposing moves must succeed in round " + round);
                Node movedA = nodeStore.get(a.id());
                Node movedB = nodeStore.get(b.id());
                assertTrue(movedA.parentId() == b.id() ^ movedB.parentId() == a.id());
            }
        } finally {
            executor.shutdownNow();
        }
    }

    private boolean attemptMove(CountDownLatch start, long nodeId, long newParentId) throws InterruptedException {
        start.await();
        try {
            gateway.move(owner, nodeId, newParentId);
            return true;
        } catch (CycleException e) {
            LOG.debugf("Move %d -> %d rejected: %s", nodeId, newParentId, e.getMessage());
            return false;
        }
    }

    private static List<Node> toList(Iterable<Node> nodes) {
        List<Node> result = new ArrayList<>();
        nodes.forEach(result::add);
        return result;
    }
}
