package keystone.platform.error.exception.marker;

/** 서킷 브레이커가 실패로 집계하는 예외 (연결 실패, 타임아웃). */
public interface CircuitBreakerRecordMarker {}
