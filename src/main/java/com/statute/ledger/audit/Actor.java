package com.statute.ledger.audit;

import java.util.Objects;

/**
 * Who triggered an audited event: an internal component, a human user, or an external system.
 */
public sealed interface Actor permits Actor.System, Actor.User, Actor.External {

    enum Kind { SYSTEM, USER, EXTERNAL }

    Kind kind();

    static System system(String component) {
        return new System(component);
    }

    static User user(String userId, String role) {
        return new User(userId, role);
    }

    static External external(String systemId) {
        return new External(systemId);
    }

    record System(String component) implements Actor {
        public System {
            Objects.requireNonNull(component, "component is required");
        }

        @Override
        public Kind kind() {
            return Kind.SYSTEM;
        }
    }

    record User(String userId, String role) implements Actor {
        public User {
            Objects.requireNonNull(userId, "userId is required");
            Objects.requireNonNull(role, "role is required");
        }

        @Override
        public Kind kind() {
            return Kind.USER;
        }
    }

    record External(String systemId) implements Actor {
        public External {
            Objects.requireNonNull(systemId, "systemId is required");
        }

        @Override
        public Kind kind() {
            return Kind.EXTERNAL;
        }
    }
}
