package com.notegraph.main.relation;

/**
 * One classification submitted by an agent. {@code relationType} is the wire label, validated on submit.
 */
public record RelationSubmission(String noteA, String noteB, String relationType, String reason) {
}
