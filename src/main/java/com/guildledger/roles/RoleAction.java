package com.guildledger.roles;

import lombok.Value;

/**
 * What a role shop button does, decoded from its action id.
 *
 * {@code panel:{panelId}} shows the plans of a panel and {@code plan:{planId}}
 * buys a plan.
 */
@Value
public class RoleAction {

    public enum Type {
        SHOW_PLANS("panel"),
        PURCHASE("plan");

        private final String prefix;

        Type(String prefix) {
            this.prefix = prefix;
        }

        public String getPrefix() {
            return prefix;
        }
    }

    Type type;
    String targetId;

    public String toActionId() {
        return type.getPrefix() + ":" + targetId;
    }

    public static RoleAction showPlans(String panelId) {
        return new RoleAction(Type.SHOW_PLANS, panelId);
    }

    public static RoleAction purchase(String planId) {
        return new RoleAction(Type.PURCHASE, planId);
    }

    /**
     * Decode an action id.
     *
     * @throws IllegalArgumentException if the id has no known prefix or no target
     */
    public static RoleAction parse(String actionId) {
        if (actionId == null) {
            throw new IllegalArgumentException("Action id is required");
        }
        int separator = actionId.indexOf(':');
        if (separator <= 0 || separator == actionId.length() - 1) {
            throw new IllegalArgumentException("Malformed action id: " + actionId);
        }
        String prefix = actionId.substring(0, separator);
        String target = actionId.substring(separator + 1);
        for (Type type : Type.values()) {
            if (type.getPrefix().equals(prefix)) {
                return new RoleAction(type, target);
            }
        }
        throw new IllegalArgumentException("Unknown action: " + actionId);
    }
}
