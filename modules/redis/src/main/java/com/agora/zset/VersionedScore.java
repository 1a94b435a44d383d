package com.agora.zset;

/**
 * 버전이 붙은 점수.
 * <p>
 * 같은 멤버에 대해 버전이 더 낮은 쓰기는 더 높은 버전으로 이미 기록된 점수를 덮어쓰지 못합니다.
 * </p>
 *
 * @param member 멤버
 * @param score 점수
 * @param version 점수가 계산된 시점 (클수록 최신)
 * @author Agora
 * @version 1.0
 */
public record VersionedScore(String member, double score, long version) {
}
