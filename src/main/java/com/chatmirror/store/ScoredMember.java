package com.chatmirror.store;

public record ScoredMember(String member, double score) {
}
