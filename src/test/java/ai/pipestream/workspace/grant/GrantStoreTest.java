package ai.pipestream.workspace.grant;

import ai.pipestream.workspace.access.AccessGateway;
import ai.pipestream.workspace.access.Authorization;
import ai.pipestream.workspace.access.NodeAction;
import ai.pipestream.workspace.error.ErrorCategory;
import ai.pipestream.workspace.error.GrantNotFoundException;
import ai.pipestream.workspace.error.PermissionDeniedException;
import ai.pipestream.workspace.identity.Identity;
import ai.pipestream.workspace.node.Node;
import ai.pipestream.workspace.permission.PermissionLevel;
import io.quarkus.test.junit.QuarkusTest;
import jakarta.inject.Inject;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.UUID;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.*;
import static org.junit.jupiter.api.Assertions.*;

@QuarkusTest
class GrantStoreTest {

    @Inject
    GrantStore grantStore;

    @Inject
    AccessGateway gateway;

    private Identity owner;
    private Node workspace;
    private Authorization sharing;

    @BeforeEach
    void setUp() {
        owner = Identity.nativeUser("owner-" + UUID.randomUUID());
        workspace = gateway.createWorkspace(owner, "Shared");
        sharing = gateway.authorize(owner, workspace.id(), PermissionLevel.OWNER, NodeAction.SHARE);
    }

    @Test
    void testPutAndFind() {
        Grant grant = grantStore.put(sharing, "reader", PermissionLevel.READ);

        assertThat(grant.nodeId(), is(workspace.id()));
        assertThat(grant.level(), is(PermissionLevel.READ));
        assertThat(grant.grantedBy(), is(owner.userId()));
        assertThat(grantStore.find(workspace.id(), "reader").orElseThrow(), is(grant));
        assertThat(grantStore.levelFor(workspace.id(), "reader"), is(PermissionLevel.READ));
        assertThat(grantStore.levelFor(workspace.id(), "stranger"), is(PermissionLevel.NONE));
    }

    @Test
    void testPutReplacesLevelAndKeepsId() {
        Grant first = grantStore.put(sharing, "editor", PermissionLevel.COMMENT);
        Grant second = grantStore.put(sharing, "editor", PermissionLevel.EDIT);

        assertEquals(first.id(), second.id());
        assertThat(grantStore.levelFor(workspace.id(), "editor"), is(PermissionLevel.EDIT));
        assertThat(grantStore.listForNode(workspace.id()), hasSize(1));
    }

    @Test
    void testNoneLevelIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> grantStore.put(sharing, "nobody", PermissionLevel.NONE));
    }

    @Test
    void testWritesDemandOwnerAuthorization() {
        Identity editor = Identity.nativeUser("editor-" + UUID.randomUUID());
        grantStore.put(sharing, editor.userId(), PermissionLevel.EDIT);
        Authorization editing = gateway.authorize(editor, workspace.id(), PermissionLevel.EDIT, NodeAction.RENAME);

        PermissionDeniedException error = assertThrows(PermissionDeniedException.class,
                () -> grantStore.put(editing, "friend", PermissionLevel.READ));
        assertEquals(ErrorCategory.PERMISSION_DENIED, error.category());
        assertThrows(PermissionDeniedException.class, () -> grantStore.revoke(editing, editor.userId()));

        assertTrue(grantStore.find(workspace.id(), "friend").isEmpty());
        assertThat(grantStore.levelFor(workspace.id(), editor.userId()), is(PermissionLevel.EDIT));
    }

    @Test
    void testRevoke() {
        grantStore.put(sharing, "temp", PermissionLevel.READ);

        Grant removed = grantStore.revoke(sharing, "temp");

        assertThat(removed.subjectId(), is("temp"));
        assertTrue(grantStore.find(workspace.id(), "temp").isEmpty());
        assertThat(grantStore.listForNode(workspace.id()), is(empty()));
    }

    @Test
    void testRevokeMissingGrant() {
        GrantNotFoundException error = assertThrows(GrantNotFoundException.class,
                () -> grantStore.revoke(sharing, "never-granted"));
        assertEquals(ErrorCategory.NOT_FOUND, error.category());
    }

    @Test
    void testListForNodeOrderedByCreation() {
        Grant a = grantStore.put(sharing, "alpha", PermissionLevel.READ);
        Grant b = grantStore.put(sharing, "bravo", PermissionLevel.EDIT);

        assertThat(grantStore.listForNode(workspace.id()), contains(a, b));
    }
}
