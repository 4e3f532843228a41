package keystone.platform.core.port.out;

import java.time.Duration;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * 키-값 저장소 기본 명령 집합
 *
 * <p>Redis 명령과 1:1로 대응하며 모든 값은 UTF-8 문자열입니다. TTL 인자가 null이면 만료를 설정하지 않습니다.
 *
 * <p>구현체는 저장소 장애를 {@code StoreConnectionException} / {@code StoreTimeoutException}으로 변환해야 합니다.
 */
public interface KeyStoreCommands {

  // ==================== String / Key ====================

  Optional<String> get(String key);

  void set(String key, String value, Duration ttl);

  /** @return 실제로 삭제된 키 수 */
  long delete(Collection<String> keys);

  boolean exists(String key);

  /** @return 키가 존재해 TTL이 설정되었으면 true */
  boolean expire(String key, Duration ttl);

  /** @return 남은 TTL. 키가 없거나 만료 없음이면 empty */
  Optional<Duration> ttl(String key);

  long increment(String key, long delta);

  /** glob 패턴 (SCAN MATCH) */
  List<String> scan(String pattern, int batchSize);

  // ==================== Hash ====================

  Map<String, String> hashGetAll(String key);

  Optional<String> hashGet(String key, String field);

  void hashPutAll(String key, Map<String, String> fields);

  long hashIncrement(String key, String field, long delta);

  // ==================== Sorted Set ====================

  /** @return 새 멤버면 true */
  boolean zAdd(String key, double score, String member);

  boolean zRemove(String key, String member);

  long zRemoveRangeByScore(String key, double min, double max);

  long zCard(String key);

  /** 점수 오름차순 rank 범위 (end 포함, -1은 마지막) */
  List<ScoredMember> zRangeWithScores(String key, int start, int end);

  /** 점수 오름차순, [min, max] 구간에서 최대 limit개 */
  List<String> zRangeByScore(String key, double min, double max, int limit);

  Optional<Double> zScore(String key, String member);

  // ==================== List ====================

  /** RPUSH. @return push 후 길이 */
  long listPush(String key, String value);

  List<String> listRange(String key, int start, int end);

  void listTrim(String key, int start, int end);

  long listLength(String key);

  // ==================== Set ====================

  long setAdd(String key, Collection<String> members);

  Set<String> setMembers(String key);

  long setRemove(String key, Collection<String> members);
}
