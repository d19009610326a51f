package com.len.songqueue.application.patron;

/**
 * 요청자 정보. 가입 계정이면 accountId, 비회원이면 tableTag 또는 접속 주소로 식별한다.
 */
public record CallerContext(
        Long accountId,
        String tableTag,
        String clientAddress
) {
    public static CallerContext anonymous(String tableTag, String clientAddress) {
        return new CallerContext(null, tableTag, clientAddress);
    }

    public boolean hasTableTag() {
        return tableTag != null && !tableTag.isBlank();
    }
}
