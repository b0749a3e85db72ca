package com.haven.common.event;

/**
 * Every account-deletion saga payload is about exactly one user.
 * The user id doubles as the broker partition key so all events of one saga stay ordered.
 */
public interface UserScopedPayload {

    String userId();
}
