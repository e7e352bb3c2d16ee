package com.klubtool.backend.modules.access.domain;

/**
 * Ways active membership alone makes a target reachable.
 */
public enum VisibilityScope {

    GROUP_MEMBER {
        @Override
        public boolean covers(MembershipContext context, AccessTarget target) {
            return context.isMemberOf(target.groupId());
        }
    },
    ANY_GROUP {
        @Override
        public boolean covers(MembershipContext context, AccessTarget target) {
            return !context.groupMemberships().isEmpty();
        }
    },
    LOCAL_REACHABLE {
        @Override
        public boolean covers(MembershipContext context, AccessTarget target) {
            return target.localId() != null && context.localIds().contains(target.localId());
        }
    },
    COUNCIL_REACHABLE {
        @Override
        public boolean covers(MembershipContext context, AccessTarget target) {
            return target.councilId() != null && context.councilIds().contains(target.councilId());
        }
    },
    ANY_COUNCIL {
        @Override
        public boolean covers(MembershipContext context, AccessTarget target) {
            return !context.councils().isEmpty();
        }
    },
    COMMITTEE_MEMBER {
        @Override
        public boolean covers(MembershipContext context, AccessTarget target) {
            return target.committeeId() != null && context.committeeIds().contains(target.committeeId());
        }
    },
    MEETING_SUBSTITUTE {
        @Override
        public boolean covers(MembershipContext context, AccessTarget target) {
            return target.committeeMeetingId() != null
                    && context.substituteMeetingIds().contains(target.committeeMeetingId());
        }
    },
    ANY_COMMITTEE {
        @Override
        public boolean covers(MembershipContext context, AccessTarget target) {
            return !context.committeeIds().isEmpty() || !context.substituteMeetingIds().isEmpty();
        }
    };

    public abstract boolean covers(MembershipContext context, AccessTarget target);
}
