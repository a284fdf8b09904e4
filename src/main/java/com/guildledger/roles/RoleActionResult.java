package com.guildledger.roles;

import lombok.Value;

import java.util.List;

/**
 * Outcome of an invoked role shop action: the plans to show, or the purchase made.
 */
@Value
public class RoleActionResult {
    RoleAction action;
    List<RolePlan> plans;
    RolePurchase purchase;

    public static RoleActionResult plans(RoleAction action, List<RolePlan> plans) {
        return new RoleActionResult(action, plans, null);
    }

    public static RoleActionResult purchased(RoleAction action, RolePurchase purchase) {
        return new RoleActionResult(action, List.of(), purchase);
    }
}
