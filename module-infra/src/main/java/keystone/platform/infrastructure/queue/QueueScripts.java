package keystone.platform.infrastructure.queue;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import keystone.platform.core.port.out.KeyStoreCommands;
import keystone.platform.core.port.out.StoreScript;
import keystone.platform.core.port.out.StoreScript.ResultType;
import keystone.platform.infrastructure.keystore.ScriptResults;

/**
 * Task Queue 원자 스크립트
 *
 * <h3>키 구조 (큐 타입 q)</h3>
 *
 * <pre>
 * ┌──────────────────────────────────────────────────────────────────────┐
 * │  queue:q                 (HASH) seq, *_total 카운터                  │
 * │  queue:q:priority        (ZSET) score = priority * 1e12 + seq        │
 * │  queue:q:tenant:{scope}  (ZSET) 같은 score, 테넌트별 대기 색인        │
 * │  queue:q:delayed         (ZSET) score = 재시도 가능 시각 (ms)         │
 * │  queue:q:inflight        (ZSET) score = 처리 제한 시각 (ms)           │
 * │  task:{id}               (HASH) 태스크                               │
 * │  deadletter:q            (ZSET) score = dead letter 시각 (ms)         │
 * │  deadletter:q:task:{id}  (STRING) JSON 기록                          │
 * └──────────────────────────────────────────────────────────────────────┘
 * </pre>
 *
 * <p>같은 우선순위 안에서는 enqueue 순번(seq)으로 FIFO를 보장합니다. 시계 오차의 영향을 받지 않습니다.
 */
public final class QueueScripts {

  /** priority 레벨 간 score 간격. seq가 이 값을 넘지 않는 한 레벨 간 순서가 섞이지 않습니다. */
  public static final double PRIORITY_STRIDE = 1e12;

  private QueueScripts() {
    throw new UnsupportedOperationException("Utility class");
  }

  /**
   * Enqueue (task id 기준 멱등)
   *
   * <pre>
   * KEYS[1] = queue:q
   * KEYS[2] = queue:q:priority
   * KEYS[3] = queue:q:tenant:{scope}
   * KEYS[4] = task:{id}
   * KEYS[5] = queue:q:delayed
   * ARGV[1] = task id
   * ARGV[2] = queue name
   * ARGV[3] = scope
   * ARGV[4] = payload
   * ARGV[5] = priority (보정 완료)
   * ARGV[6] = max attempts
   * ARGV[7] = now (ms)
   * ARGV[8] = queue max size
   * ARGV[9] = tenant limit
   *
   * Returns: {1, seq} 신규, {0, 0} 이미 존재, {-1, 0} 큐 가득 참, {-2, 0} 테넌트 한도 초과
   * </pre>
   */
  public static final StoreScript ENQUEUE =
      StoreScript.of(
          "queue-enqueue",
          """
          if redis.call('EXISTS', KEYS[4]) == 1 then
              return {0, 0}
          end
          local pending = redis.call('ZCARD', KEYS[2]) + redis.call('ZCARD', KEYS[5])
          if pending >= tonumber(ARGV[8]) then
              return {-1, 0}
          end
          if redis.call('ZCARD', KEYS[3]) >= tonumber(ARGV[9]) then
              return {-2, 0}
          end
          local seq = redis.call('HINCRBY', KEYS[1], 'seq', 1)
          local score = string.format('%.0f', tonumber(ARGV[5]) * 1e12 + seq)
          redis.call('HSET', KEYS[4], 'id', ARGV[1], 'type', ARGV[2], 'scope', ARGV[3],
              'payload', ARGV[4], 'priority', ARGV[5], 'attempts', 0, 'max_attempts', ARGV[6],
              'status', 'queued', 'enqueued_at', ARGV[7], 'seq', seq)
          redis.call('ZADD', KEYS[2], score, ARGV[1])
          redis.call('ZADD', KEYS[3], score, ARGV[1])
          redis.call('HINCRBY', KEYS[1], 'enqueued_total', 1)
          return {1, seq}
          """,
          ResultType.MULTI,
          QueueScripts::enqueue);

  /**
   * Dequeue (원자적 선택 + in_progress 전이)
   *
   * <ol>
   *   <li>재시도 시각이 지난 delayed 태스크를 대기열로 승격 (status=queued, 새 seq)
   *   <li>가장 낮은 score(가장 긴급, 가장 오래된) 태스크 선택
   *   <li>대기열과 테넌트 색인에서 제거
   *   <li>status=in_progress, started_at, attempts+1, in-flight 등록
   * </ol>
   *
   * <pre>
   * KEYS[1] = queue:q
   * KEYS[2] = queue:q:priority
   * KEYS[3] = queue:q:delayed
   * KEYS[4] = queue:q:inflight
   * ARGV[1] = now (ms)
   * ARGV[2] = in-flight deadline (ms)
   * ARGV[3] = task key prefix (task:)
   * ARGV[4] = tenant index prefix (queue:q:tenant:)
   * ARGV[5] = scope 필터 ('' = 전체)
   * ARGV[6] = 승격 최대 개수
   *
   * Returns: 태스크 HGETALL, 없으면 빈 배열
   * </pre>
   */
  public static final StoreScript DEQUEUE =
      StoreScript.of(
          "queue-dequeue",
          """
          local due = redis.call('ZRANGEBYSCORE', KEYS[3], '-inf', ARGV[1],
              'LIMIT', 0, tonumber(ARGV[6]))
          for _, id in ipairs(due) do
              redis.call('ZREM', KEYS[3], id)
              local tk = ARGV[3] .. id
              if redis.call('EXISTS', tk) == 1 then
                  local seq = redis.call('HINCRBY', KEYS[1], 'seq', 1)
                  local priority = tonumber(redis.call('HGET', tk, 'priority'))
                  local score = string.format('%.0f', priority * 1e12 + seq)
                  redis.call('HSET', tk, 'status', 'queued', 'seq', seq)
                  redis.call('ZADD', KEYS[2], score, id)
                  redis.call('ZADD', ARGV[4] .. redis.call('HGET', tk, 'scope'), score, id)
              end
          end
          local source = KEYS[2]
          if ARGV[5] ~= '' then
              source = ARGV[4] .. ARGV[5]
          end
          local head = redis.call('ZRANGE', source, 0, 0)
          local id = head[1]
          if not id then
              return {}
          end
          local tk = ARGV[3] .. id
          redis.call('ZREM', KEYS[2], id)
          local scope = redis.call('HGET', tk, 'scope')
          if not scope then
              redis.call('ZREM', source, id)
              return {}
          end
          redis.call('ZREM', ARGV[4] .. scope, id)
          redis.call('HSET', tk, 'status', 'in_progress', 'started_at', ARGV[1])
          redis.call('HINCRBY', tk, 'attempts', 1)
          redis.call('ZADD', KEYS[4], ARGV[2], id)
          return redis.call('HGETALL', tk)
          """,
          ResultType.MULTI,
          QueueScripts::dequeue);

  /**
   * Complete (in_progress → succeeded)
   *
   * <pre>
   * KEYS[1] = queue:q
   * KEYS[2] = queue:q:inflight
   * KEYS[3] = task:{id}
   * ARGV[1] = task id
   * ARGV[2] = now (ms)
   * ARGV[3] = result
   * ARGV[4] = task ttl (ms)
   *
   * Returns: 1 완료, -1 없음, -2 in_progress 아님
   * </pre>
   */
  public static final StoreScript COMPLETE =
      StoreScript.of(
          "queue-complete",
          """
          local status = redis.call('HGET', KEYS[3], 'status')
          if not status then
              return -1
          end
          if status ~= 'in_progress' then
              return -2
          end
          redis.call('HSET', KEYS[3], 'status', 'succeeded',
              'completed_at', ARGV[2], 'result', ARGV[3])
          redis.call('PEXPIRE', KEYS[3], ARGV[4])
          redis.call('ZREM', KEYS[2], ARGV[1])
          redis.call('HINCRBY', KEYS[1], 'completed_total', 1)
          return 1
          """,
          ResultType.INTEGER,
          QueueScripts::complete);

  /**
   * Fail (in_progress → failed → delayed 재시도 | dead_lettered)
   *
   * <p>attempts를 기대값과 비교(CAS)해, 다시 배달된 태스크에 대한 오래된 실패 보고를 거부합니다. backoff 지연과 dead letter JSON은
   * 호출자가 계산합니다.
   *
   * <pre>
   * KEYS[1] = queue:q
   * KEYS[2] = queue:q:inflight
   * KEYS[3] = queue:q:delayed
   * KEYS[4] = task:{id}
   * KEYS[5] = deadletter:q
   * KEYS[6] = deadletter:q:task:{id}
   * ARGV[1] = task id
   * ARGV[2] = 기대 attempts
   * ARGV[3] = now (ms)
   * ARGV[4] = error
   * ARGV[5] = 'retry' | 'dead'
   * ARGV[6] = 재시도 가능 시각 (ms)
   * ARGV[7] = 재시도 priority
   * ARGV[8] = dead letter JSON
   * ARGV[9] = task ttl (ms)
   * ARGV[10] = dead letter 보존 (ms)
   *
   * Returns: 1 재시도 예약, 2 dead letter, -1 없음, -2 in_progress 아님, -3 attempts 불일치
   * </pre>
   */
  public static final StoreScript FAIL =
      StoreScript.of(
          "queue-fail",
          """
          local status = redis.call('HGET', KEYS[4], 'status')
          if not status then
              return -1
          end
          if status ~= 'in_progress' then
              return -2
          end
          if redis.call('HGET', KEYS[4], 'attempts') ~= ARGV[2] then
              return -3
          end
          redis.call('ZREM', KEYS[2], ARGV[1])
          redis.call('HINCRBY', KEYS[1], 'failed_total', 1)
          if ARGV[5] == 'retry' then
              redis.call('HSET', KEYS[4], 'status', 'failed', 'last_error', ARGV[4],
                  'next_attempt_at', ARGV[6], 'priority', ARGV[7])
              redis.call('ZADD', KEYS[3], ARGV[6], ARGV[1])
              return 1
          end
          redis.call('HSET', KEYS[4], 'status', 'dead_lettered', 'last_error', ARGV[4],
              'completed_at', ARGV[3])
          redis.call('PEXPIRE', KEYS[4], ARGV[9])
          redis.call('SET', KEYS[6], ARGV[8], 'PX', ARGV[10])
          redis.call('ZADD', KEYS[5], ARGV[3], ARGV[1])
          redis.call('HINCRBY', KEYS[1], 'dead_lettered_total', 1)
          return 2
          """,
          ResultType.INTEGER,
          QueueScripts::fail);

  /**
   * Dead letter 재처리 (attempts 초기화 후 대기열 재진입)
   *
   * <pre>
   * KEYS[1] = queue:q
   * KEYS[2] = queue:q:priority
   * KEYS[3] = queue:q:delayed
   * KEYS[4] = deadletter:q
   * KEYS[5] = deadletter:q:task:{id}
   * KEYS[6] = task:{id}
   * KEYS[7] = queue:q:tenant:{scope}
   * ARGV[1] = task id
   * ARGV[2] = queue name
   * ARGV[3] = scope
   * ARGV[4] = payload
   * ARGV[5] = priority
   * ARGV[6] = max attempts
   * ARGV[7] = now (ms)
   * ARGV[8] = queue max size
   * ARGV[9] = auto retry count
   *
   * Returns: seq, -1 기록 없음, -2 큐 가득 참
   * </pre>
   */
  public static final StoreScript REPROCESS =
      StoreScript.of(
          "queue-deadletter-reprocess",
          """
          if redis.call('EXISTS', KEYS[5]) == 0 then
              return -1
          end
          local pending = redis.call('ZCARD', KEYS[2]) + redis.call('ZCARD', KEYS[3])
          if pending >= tonumber(ARGV[8]) then
              return -2
          end
          local seq = redis.call('HINCRBY', KEYS[1], 'seq', 1)
          local score = string.format('%.0f', tonumber(ARGV[5]) * 1e12 + seq)
          redis.call('DEL', KEYS[6])
          redis.call('HSET', KEYS[6], 'id', ARGV[1], 'type', ARGV[2], 'scope', ARGV[3],
              'payload', ARGV[4], 'priority', ARGV[5], 'attempts', 0, 'max_attempts', ARGV[6],
              'status', 'queued', 'enqueued_at', ARGV[7], 'seq', seq, 'auto_retry_count', ARGV[9])
          redis.call('ZADD', KEYS[2], score, ARGV[1])
          redis.call('ZADD', KEYS[7], score, ARGV[1])
          redis.call('ZREM', KEYS[4], ARGV[1])
          redis.call('DEL', KEYS[5])
          redis.call('HINCRBY', KEYS[1], 'enqueued_total', 1)
          return seq
          """,
          ResultType.INTEGER,
          QueueScripts::reprocess);

  public static List<StoreScript> all() {
    return List.of(ENQUEUE, DEQUEUE, COMPLETE, FAIL, REPROCESS);
  }

  public static double score(long priority, long seq) {
    return priority * PRIORITY_STRIDE + seq;
  }

  // ==================== Java 구현 ====================

  private static Object enqueue(KeyStoreCommands store, List<String> keys, List<String> args) {
    if (store.exists(keys.get(3))) {
      return List.of(0L, 0L);
    }
    long pending = store.zCard(keys.get(1)) + store.zCard(keys.get(4));
    if (pending >= Long.parseLong(args.get(7))) {
      return List.of(-1L, 0L);
    }
    if (store.zCard(keys.get(2)) >= Long.parseLong(args.get(8))) {
      return List.of(-2L, 0L);
    }
    long seq = store.hashIncrement(keys.get(0), "seq", 1);
    double score = score(Long.parseLong(args.get(4)), seq);
    Map<String, String> fields = new LinkedHashMap<>();
    fields.put("id", args.get(0));
    fields.put("type", args.get(1));
    fields.put("scope", args.get(2));
    fields.put("payload", args.get(3));
    fields.put("priority", args.get(4));
    fields.put("attempts", "0");
    fields.put("max_attempts", args.get(5));
    fields.put("status", "queued");
    fields.put("enqueued_at", args.get(6));
    fields.put("seq", String.valueOf(seq));
    store.hashPutAll(keys.get(3), fields);
    store.zAdd(keys.get(1), score, args.get(0));
    store.zAdd(keys.get(2), score, args.get(0));
    store.hashIncrement(keys.get(0), "enqueued_total", 1);
    return List.of(1L, seq);
  }

  private static Object dequeue(KeyStoreCommands store, List<String> keys, List<String> args) {
    String queue = keys.get(0);
    String priority = keys.get(1);
    String delayed = keys.get(2);
    String inflight = keys.get(3);
    long now = Long.parseLong(args.get(0));
    String taskPrefix = args.get(2);
    String tenantPrefix = args.get(3);

    int promoteLimit = Integer.parseInt(args.get(5));
    for (String id : store.zRangeByScore(delayed, Double.NEGATIVE_INFINITY, now, promoteLimit)) {
      store.zRemove(delayed, id);
      String taskKey = taskPrefix + id;
      if (store.exists(taskKey)) {
        long seq = store.hashIncrement(queue, "seq", 1);
        long level = Long.parseLong(store.hashGet(taskKey, "priority").orElse("0"));
        double score = score(level, seq);
        store.hashPutAll(taskKey, Map.of("status", "queued", "seq", String.valueOf(seq)));
        store.zAdd(priority, score, id);
        store.zAdd(tenantPrefix + store.hashGet(taskKey, "scope").orElse(""), score, id);
      }
    }

    String source = args.get(4).isEmpty() ? priority : tenantPrefix + args.get(4);
    List<String> head =
        store.zRangeByScore(source, Double.NEGATIVE_INFINITY, Double.POSITIVE_INFINITY, 1);
    if (head.isEmpty()) {
      return new ArrayList<>();
    }
    String id = head.get(0);
    String taskKey = taskPrefix + id;
    store.zRemove(priority, id);
    String scope = store.hashGet(taskKey, "scope").orElse(null);
    if (scope == null) {
      store.zRemove(source, id);
      return new ArrayList<>();
    }
    store.zRemove(tenantPrefix + scope, id);
    store.hashPutAll(taskKey, Map.of("status", "in_progress", "started_at", args.get(0)));
    store.hashIncrement(taskKey, "attempts", 1);
    store.zAdd(inflight, Double.parseDouble(args.get(1)), id);
    return ScriptResults.flatten(store.hashGetAll(taskKey));
  }

  private static Object complete(KeyStoreCommands store, List<String> keys, List<String> args) {
    String taskKey = keys.get(2);
    String status = store.hashGet(taskKey, "status").orElse(null);
    if (status == null) {
      return -1L;
    }
    if (!"in_progress".equals(status)) {
      return -2L;
    }
    Map<String, String> fields = new LinkedHashMap<>();
    fields.put("status", "succeeded");
    fields.put("completed_at", args.get(1));
    fields.put("result", args.get(2));
    store.hashPutAll(taskKey, fields);
    store.expire(taskKey, Duration.ofMillis(Long.parseLong(args.get(3))));
    store.zRemove(keys.get(1), args.get(0));
    store.hashIncrement(keys.get(0), "completed_total", 1);
    return 1L;
  }

  private static Object fail(KeyStoreCommands store, List<String> keys, List<String> args) {
    String taskKey = keys.get(3);
    String status = store.hashGet(taskKey, "status").orElse(null);
    if (status == null) {
      return -1L;
    }
    if (!"in_progress".equals(status)) {
      return -2L;
    }
    if (!args.get(1).equals(store.hashGet(taskKey, "attempts").orElse(null))) {
      return -3L;
    }
    store.zRemove(keys.get(1), args.get(0));
    store.hashIncrement(keys.get(0), "failed_total", 1);
    Map<String, String> fields = new LinkedHashMap<>();
    if ("retry".equals(args.get(4))) {
      fields.put("status", "failed");
      fields.put("last_error", args.get(3));
      fields.put("next_attempt_at", args.get(5));
      fields.put("priority", args.get(6));
      store.hashPutAll(taskKey, fields);
      store.zAdd(keys.get(2), Double.parseDouble(args.get(5)), args.get(0));
      return 1L;
    }
    fields.put("status", "dead_lettered");
    fields.put("last_error", args.get(3));
    fields.put("completed_at", args.get(2));
    store.hashPutAll(taskKey, fields);
    store.expire(taskKey, Duration.ofMillis(Long.parseLong(args.get(8))));
    store.set(keys.get(5), args.get(7), Duration.ofMillis(Long.parseLong(args.get(9))));
    store.zAdd(keys.get(4), Double.parseDouble(args.get(2)), args.get(0));
    store.hashIncrement(keys.get(0), "dead_lettered_total", 1);
    return 2L;
  }

  private static Object reprocess(KeyStoreCommands store, List<String> keys, List<String> args) {
    if (!store.exists(keys.get(4))) {
      return -1L;
    }
    long pending = store.zCard(keys.get(1)) + store.zCard(keys.get(2));
    if (pending >= Long.parseLong(args.get(7))) {
      return -2L;
    }
    long seq = store.hashIncrement(keys.get(0), "seq", 1);
    double score = score(Long.parseLong(args.get(4)), seq);
    store.delete(List.of(keys.get(5)));
    Map<String, String> fields = new LinkedHashMap<>();
    fields.put("id", args.get(0));
    fields.put("type", args.get(1));
    fields.put("scope", args.get(2));
    fields.put("payload", args.get(3));
    fields.put("priority", args.get(4));
    fields.put("attempts", "0");
    fields.put("max_attempts", args.get(5));
    fields.put("status", "queued");
    fields.put("enqueued_at", args.get(6));
    fields.put("seq", String.valueOf(seq));
    fields.put("auto_retry_count", args.get(8));
    store.hashPutAll(keys.get(5), fields);
    store.zAdd(keys.get(1), score, args.get(0));
    store.zAdd(keys.get(6), score, args.get(0));
    store.zRemove(keys.get(3), args.get(0));
    store.delete(List.of(keys.get(4)));
    store.hashIncrement(keys.get(0), "enqueued_total", 1);
    return seq;
  }
}
