package keystone.platform.infrastructure.keystore;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.NavigableSet;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;
import java.util.regex.Pattern;
import keystone.platform.core.port.out.KeyStoreClient;
import keystone.platform.core.port.out.ScoredMember;
import keystone.platform.core.port.out.StoreScript;
import keystone.platform.error.exception.StoreScriptExecutionException;
import lombok.extern.slf4j.Slf4j;

/**
 * 단일 노드용 In-Memory 저장소
 *
 * <h3>용도</h3>
 *
 * <ul>
 *   <li>{@code keystone.store.mode=in-memory}: Redis 없는 로컬/단일 인스턴스 실행
 *   <li>단위 테스트: 주입된 {@link Clock}으로 TTL과 윈도우를 결정적으로 검증
 * </ul>
 *
 * <h3>원자성</h3>
 *
 * <p>모든 명령과 스크립트는 하나의 {@link ReentrantLock} 아래에서 실행됩니다. 스크립트는 {@link StoreScript#local()} 구현이
 * 이 클라이언트의 명령을 재진입 호출하므로, Redis의 Lua 실행과 같은 "다른 명령이 끼어들 수 없음" 보장을 가집니다.
 *
 * <p>만료는 접근 시점에 지연 판정합니다 (lazy expiration).
 */
@Slf4j
public class InMemoryKeyStoreClient implements KeyStoreClient {

  private final Map<String, Entry> data = new HashMap<>();
  private final ReentrantLock lock = new ReentrantLock();
  private final Clock clock;

  public InMemoryKeyStoreClient(Clock clock) {
    this.clock = clock;
  }

  // ==================== String / Key ====================

  @Override
  public Optional<String> get(String key) {
    return locked(() -> Optional.ofNullable(live(key)).map(e -> e.as(String.class, key)));
  }

  @Override
  public void set(String key, String value, Duration ttl) {
    locked(
        () -> {
          data.put(key, new Entry(value, expiryOf(ttl)));
          return null;
        });
  }

  @Override
  public long delete(Collection<String> keys) {
    return locked(
        () -> {
          long removed = 0;
          for (String key : keys) {
            if (live(key) != null) {
              data.remove(key);
              removed++;
            }
          }
          return removed;
        });
  }

  @Override
  public boolean exists(String key) {
    return locked(() -> live(key) != null);
  }

  @Override
  public boolean expire(String key, Duration ttl) {
    return locked(
        () -> {
          Entry entry = live(key);
          if (entry == null) {
            return false;
          }
          entry.expiresAtMillis = expiryOf(ttl);
          return true;
        });
  }

  @Override
  public Optional<Duration> ttl(String key) {
    return locked(
        () -> {
          Entry entry = live(key);
          if (entry == null || entry.expiresAtMillis == 0) {
            return Optional.empty();
          }
          return Optional.of(Duration.ofMillis(entry.expiresAtMillis - clock.millis()));
        });
  }

  @Override
  public long increment(String key, long delta) {
    return locked(
        () -> {
          Entry entry = live(key);
          long current = entry == null ? 0 : parseLong(entry.as(String.class, key), key);
          long next = current + delta;
          if (entry == null) {
            data.put(key, new Entry(Long.toString(next), 0));
          } else {
            entry.value = Long.toString(next);
          }
          return next;
        });
  }

  @Override
  public List<String> scan(String pattern, int batchSize) {
    Pattern regex = globToRegex(pattern);
    return locked(
        () -> {
          List<String> matched = new ArrayList<>();
          for (String key : new ArrayList<>(data.keySet())) {
            if (live(key) != null && regex.matcher(key).matches()) {
              matched.add(key);
            }
          }
          return matched;
        });
  }

  // ==================== Hash ====================

  @Override
  public Map<String, String> hashGetAll(String key) {
    return locked(
        () -> {
          Map<String, String> hash = hashOrNull(key);
          return hash == null ? Map.of() : new LinkedHashMap<>(hash);
        });
  }

  @Override
  public Optional<String> hashGet(String key, String field) {
    return locked(
        () -> {
          Map<String, String> hash = hashOrNull(key);
          return hash == null ? Optional.<String>empty() : Optional.ofNullable(hash.get(field));
        });
  }

  @Override
  public void hashPutAll(String key, Map<String, String> fields) {
    locked(
        () -> {
          hashOrCreate(key).putAll(fields);
          return null;
        });
  }

  @Override
  public long hashIncrement(String key, String field, long delta) {
    return locked(
        () -> {
          Map<String, String> hash = hashOrCreate(key);
          long next = parseLong(hash.getOrDefault(field, "0"), key) + delta;
          hash.put(field, Long.toString(next));
          return next;
        });
  }

  // ==================== Sorted Set ====================

  @Override
  public boolean zAdd(String key, double score, String member) {
    return locked(() -> zsetOrCreate(key).add(member, score));
  }

  @Override
  public boolean zRemove(String key, String member) {
    return locked(
        () -> {
          SortedSetValue zset = zsetOrNull(key);
          boolean removed = zset != null && zset.remove(member);
          dropIfEmpty(key, zset != null && zset.isEmpty());
          return removed;
        });
  }

  @Override
  public long zRemoveRangeByScore(String key, double min, double max) {
    return locked(
        () -> {
          SortedSetValue zset = zsetOrNull(key);
          if (zset == null) {
            return 0L;
          }
          long removed = zset.removeRangeByScore(min, max);
          dropIfEmpty(key, zset.isEmpty());
          return removed;
        });
  }

  @Override
  public long zCard(String key) {
    return locked(
        () -> {
          SortedSetValue zset = zsetOrNull(key);
          return zset == null ? 0L : (long) zset.size();
        });
  }

  @Override
  public List<ScoredMember> zRangeWithScores(String key, int start, int end) {
    return locked(
        () -> {
          SortedSetValue zset = zsetOrNull(key);
          if (zset == null) {
            return List.<ScoredMember>of();
          }
          List<ScoredMember> all = new ArrayList<>(zset.ordered);
          return slice(all, start, end);
        });
  }

  @Override
  public List<String> zRangeByScore(String key, double min, double max, int limit) {
    return locked(
        () -> {
          SortedSetValue zset = zsetOrNull(key);
          if (zset == null) {
            return List.<String>of();
          }
          List<String> result = new ArrayList<>();
          for (ScoredMember m : zset.ordered) {
            if (m.score() > max || result.size() >= limit) {
              break;
            }
            if (m.score() >= min) {
              result.add(m.member());
            }
          }
          return result;
        });
  }

  @Override
  public Optional<Double> zScore(String key, String member) {
    return locked(
        () -> {
          SortedSetValue zset = zsetOrNull(key);
          return zset == null
              ? Optional.<Double>empty()
              : Optional.ofNullable(zset.scores.get(member));
        });
  }

  // ==================== List ====================

  @Override
  public long listPush(String key, String value) {
    return locked(
        () -> {
          List<String> list = listOrCreate(key);
          list.add(value);
          return (long) list.size();
        });
  }

  @Override
  public List<String> listRange(String key, int start, int end) {
    return locked(
        () -> {
          List<String> list = listOrNull(key);
          return list == null ? List.<String>of() : slice(list, start, end);
        });
  }

  @Override
  public void listTrim(String key, int start, int end) {
    locked(
        () -> {
          List<String> list = listOrNull(key);
          if (list == null) {
            return null;
          }
          List<String> kept = slice(list, start, end);
          list.clear();
          list.addAll(kept);
          dropIfEmpty(key, list.isEmpty());
          return null;
        });
  }

  @Override
  public long listLength(String key) {
    return locked(
        () -> {
          List<String> list = listOrNull(key);
          return list == null ? 0L : (long) list.size();
        });
  }

  // ==================== Set ====================

  @Override
  public long setAdd(String key, Collection<String> members) {
    return locked(
        () -> {
          Set<String> set = setOrCreate(key);
          long added = 0;
          for (String member : members) {
            if (set.add(member)) {
              added++;
            }
          }
          return added;
        });
  }

  @Override
  public Set<String> setMembers(String key) {
    return locked(
        () -> {
          Set<String> set = setOrNull(key);
          return set == null ? Set.<String>of() : new LinkedHashSet<>(set);
        });
  }

  @Override
  public long setRemove(String key, Collection<String> members) {
    return locked(
        () -> {
          Set<String> set = setOrNull(key);
          if (set == null) {
            return 0L;
          }
          long removed = members.stream().filter(set::remove).count();
          dropIfEmpty(key, set.isEmpty());
          return removed;
        });
  }

  // ==================== Connection / Script ====================

  @Override
  public String ping() {
    return "PONG";
  }

  @Override
  public Object eval(StoreScript script, List<String> keys, List<String> args) {
    return locked(() -> script.local().execute(this, keys, args));
  }

  /** 테스트 및 진단용: 만료되지 않은 키 수 */
  public int size() {
    return locked(
        () -> (int) new ArrayList<>(data.keySet()).stream().filter(k -> live(k) != null).count());
  }

  // ==================== internals ====================

  private <T> T locked(Supplier<T> action) {
    lock.lock();
    try {
      return action.get();
    } finally {
      lock.unlock();
    }
  }

  private Entry live(String key) {
    Entry entry = data.get(key);
    if (entry == null) {
      return null;
    }
    if (entry.expiresAtMillis != 0 && entry.expiresAtMillis <= clock.millis()) {
      data.remove(key);
      return null;
    }
    return entry;
  }

  private long expiryOf(Duration ttl) {
    if (ttl == null) {
      return 0;
    }
    return clock.millis() + Math.max(1, ttl.toMillis());
  }

  private void dropIfEmpty(String key, boolean empty) {
    if (empty) {
      data.remove(key);
    }
  }

  @SuppressWarnings("unchecked")
  private Map<String, String> hashOrNull(String key) {
    Entry entry = live(key);
    return entry == null ? null : entry.as(Map.class, key);
  }

  private Map<String, String> hashOrCreate(String key) {
    Map<String, String> hash = hashOrNull(key);
    if (hash == null) {
      hash = new LinkedHashMap<>();
      data.put(key, new Entry(hash, 0));
    }
    return hash;
  }

  private SortedSetValue zsetOrNull(String key) {
    Entry entry = live(key);
    return entry == null ? null : entry.as(SortedSetValue.class, key);
  }

  private SortedSetValue zsetOrCreate(String key) {
    SortedSetValue zset = zsetOrNull(key);
    if (zset == null) {
      zset = new SortedSetValue();
      data.put(key, new Entry(zset, 0));
    }
    return zset;
  }

  @SuppressWarnings("unchecked")
  private List<String> listOrNull(String key) {
    Entry entry = live(key);
    return entry == null ? null : entry.as(List.class, key);
  }

  private List<String> listOrCreate(String key) {
    List<String> list = listOrNull(key);
    if (list == null) {
      list = new ArrayList<>();
      data.put(key, new Entry(list, 0));
    }
    return list;
  }

  @SuppressWarnings("unchecked")
  private Set<String> setOrNull(String key) {
    Entry entry = live(key);
    return entry == null ? null : entry.as(Set.class, key);
  }

  private Set<String> setOrCreate(String key) {
    Set<String> set = setOrNull(key);
    if (set == null) {
      set = new LinkedHashSet<>();
      data.put(key, new Entry(set, 0));
    }
    return set;
  }

  /** Redis LRANGE/ZRANGE 인덱스 규칙 (음수는 끝에서부터, end 포함) */
  private static <T> List<T> slice(List<T> source, int start, int end) {
    int size = source.size();
    int from = start < 0 ? Math.max(0, size + start) : start;
    int to = end < 0 ? size + end : Math.min(end, size - 1);
    if (from > to || from >= size) {
      return new ArrayList<>();
    }
    return new ArrayList<>(source.subList(from, to + 1));
  }

  private static long parseLong(String value, String key) {
    try {
      return Long.parseLong(value);
    } catch (NumberFormatException e) {
      throw new StoreScriptExecutionException("ERR value is not an integer: " + key, e);
    }
  }

  /** {@code *}, {@code ?} 만 지원. 문자 클래스({@code [...]})는 리터럴로 취급 */
  static Pattern globToRegex(String glob) {
    StringBuilder regex = new StringBuilder();
    for (char c : glob.toCharArray()) {
      switch (c) {
        case '*' -> regex.append(".*");
        case '?' -> regex.append('.');
        default -> regex.append(Pattern.quote(String.valueOf(c)));
      }
    }
    return Pattern.compile(regex.toString(), Pattern.DOTALL);
  }

  private static final class Entry {
    private Object value;
    private long expiresAtMillis;

    private Entry(Object value, long expiresAtMillis) {
      this.value = value;
      this.expiresAtMillis = expiresAtMillis;
    }

    <T> T as(Class<T> type, String key) {
      if (!type.isInstance(value)) {
        throw new StoreScriptExecutionException(
            "WRONGTYPE Operation against a key holding the wrong kind of value: " + key);
      }
      return type.cast(value);
    }
  }

  /** 점수 오름차순, 동점이면 멤버 사전순 (Redis 규칙) */
  private static final class SortedSetValue {
    private static final Comparator<ScoredMember> ORDER =
        Comparator.comparingDouble(ScoredMember::score).thenComparing(ScoredMember::member);

    private final Map<String, Double> scores = new HashMap<>();
    private final NavigableSet<ScoredMember> ordered = new TreeSet<>(ORDER);

    boolean add(String member, double score) {
      Double previous = scores.put(member, score);
      if (previous != null) {
        ordered.remove(new ScoredMember(member, previous));
      }
      ordered.add(new ScoredMember(member, score));
      return previous == null;
    }

    boolean remove(String member) {
      Double previous = scores.remove(member);
      if (previous == null) {
        return false;
      }
      ordered.remove(new ScoredMember(member, previous));
      return true;
    }

    long removeRangeByScore(double min, double max) {
      List<ScoredMember> doomed =
          ordered.stream().filter(m -> m.score() >= min && m.score() <= max).toList();
      doomed.forEach(m -> remove(m.member()));
      return doomed.size();
    }

    int size() {
      return scores.size();
    }

    boolean isEmpty() {
      return scores.isEmpty();
    }
  }
}
