package keystone.platform.core.port.out;

public record ScoredMember(String member, double score) {}
