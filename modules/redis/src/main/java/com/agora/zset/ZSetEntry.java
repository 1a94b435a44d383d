package com.agora.zset;

/**
 * 정렬 집합의 멤버와 점수.
 *
 * @param member 멤버
 * @param score 점수
 * @author Agora
 * @version 1.0
 */
public record ZSetEntry(String member, double score) {

    /**
     * 정수로 기록한 점수를 그대로 돌려받기 위한 변환입니다.
     * Redis는 점수를 double로 저장하므로 2^53 이하의 정수는 손실 없이 복원됩니다.
     *
     * @return 반올림한 점수
     */
    public long scoreAsLong() {
        return Math.round(score);
    }
}
