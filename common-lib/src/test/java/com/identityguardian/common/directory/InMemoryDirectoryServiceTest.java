package com.identityguardian.common.directory;

import com.identityguardian.common.model.AccessGrant;
import com.identityguardian.common.model.GroupRecord;
import com.identityguardian.common.model.Principal;
import com.identityguardian.common.model.PrincipalFilter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Flux;
import reactor.core.scheduler.Schedulers;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryDirectoryServiceTest {

    private InMemoryDirectoryService directory;

    @BeforeEach
    void setUp() {
        directory = InMemoryDirectoryService.withSampleTenant();
    }

    @Nested
    @DisplayName("principals")
    class Principals {

        @Test
        @DisplayName("unknown principal → empty")
        void unknownPrincipalIsEmpty() {
            StepVerifier.create(directory.getPrincipal("nobody")).verifyComplete();
        }

        @Test
        @DisplayName("disabled principals are excluded by activeOnly()")
        void activeOnlyFilter() {
            directory.putPrincipal(new Principal("user009", "gone@company.com", "Gone", "Sales", false, List.of()));

            StepVerifier.create(directory.listPrincipals(PrincipalFilter.activeOnly()).count())
                .expectNext(3L)
                .verifyComplete();
            StepVerifier.create(directory.listPrincipals(PrincipalFilter.all()).count())
                .expectNext(4L)
                .verifyComplete();
        }

        @Test
        @DisplayName("disable then enable round-trips the enabled flag")
        void disableEnable() {
            StepVerifier.create(directory.disablePrincipal("user001", "test")).expectNextCount(1).verifyComplete();
            assertFalse(directory.isEnabled("user001"));

            StepVerifier.create(directory.enablePrincipal("user001")).expectNextCount(1).verifyComplete();
            assertTrue(directory.isEnabled("user001"));
        }

        @Test
        @DisplayName("grants added from many threads are all kept")
        void concurrentGrants() {
            Flux.range(0, 200)
                .parallel(8)
                .runOn(Schedulers.parallel())
                .doOnNext(i -> directory.putGrant(new AccessGrant("user001", "resource-" + i, "read")))
                .sequential()
                .blockLast(Duration.ofSeconds(5));

            StepVerifier.create(directory.listAccessGrants("user001").count())
                .expectNext(200L)
                .verifyComplete();
        }

        @Test
        @DisplayName("disabling an unknown principal signals DirectoryException")
        void disableUnknown() {
            StepVerifier.create(directory.disablePrincipal("nobody", "test"))
                .expectError(DirectoryException.class)
                .verify();
        }
    }

    @Nested
    @DisplayName("conditional access")
    class ConditionalAccess {

        @Test
        @DisplayName("block then remove reports one deleted policy")
        void blockAndRemove() {
            StepVerifier.create(directory.conditionalAccessBlock("user002", "risk"))
                .expectNext("Conditional Access block applied. Policy ID: mock-ca-user002")
                .verifyComplete();
            assertTrue(directory.isBlocked("user002"));

            StepVerifier.create(directory.removeConditionalAccessBlock("user002"))
                .expectNext("Conditional Access block removed for user002. Policies deleted: 1")
                .verifyComplete();
            assertFalse(directory.isBlocked("user002"));
        }
    }

    @Nested
    @DisplayName("groups")
    class Groups {

        @Test
        @DisplayName("creating a duplicate display name signals GroupConflictException")
        void duplicateCreateConflicts() {
            StepVerifier.create(directory.createGroup("IG-Developer")).expectNextCount(1).verifyComplete();

            StepVerifier.create(directory.createGroup("IG-Developer"))
                .expectError(GroupConflictException.class)
                .verify();
            assertEquals(1, directory.groupCount());
        }

        @Test
        @DisplayName("membership add is a union and remove of an absent member is a no-op")
        void membershipIsIdempotent() {
            directory.putGroup("g1", "IG-Finance", Set.of("user002"));

            StepVerifier.create(directory.addGroupMembers("g1", Set.of("user002", "user003"))).verifyComplete();
            StepVerifier.create(directory.removeGroupMembers("g1", Set.of("user001"))).verifyComplete();

            GroupRecord group = directory.getGroup("g1").block();
            assertNotNull(group);
            assertEquals(Set.of("user002", "user003"), group.members());
        }

        @Test
        @DisplayName("member update on a missing group signals DirectoryException")
        void missingGroup() {
            StepVerifier.create(directory.addGroupMembers("missing", Set.of("user001")))
                .expectError(DirectoryException.class)
                .verify();
        }
    }

    @Nested
    @DisplayName("privileged requests")
    class PrivilegedRequests {

        @Test
        @DisplayName("approve moves the request to Provisioned")
        void approve() {
            directory.putPrivilegedRequest("req-1");

            StepVerifier.create(directory.approvePrivilegedRequest("req-1")).expectNextCount(1).verifyComplete();
            assertEquals("Provisioned", directory.privilegedRequestStatus("req-1"));
        }

        @Test
        @DisplayName("rejecting an unknown request signals DirectoryException")
        void rejectUnknown() {
            StepVerifier.create(directory.rejectPrivilegedRequest("req-404", "no"))
                .expectError(DirectoryException.class)
                .verify();
        }
    }
}
