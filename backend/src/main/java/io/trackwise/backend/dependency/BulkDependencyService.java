package io.trackwise.backend.dependency;

import io.trackwise.backend.exception.CircularDependencyException;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.web.ErrorResponseException;

/**
 * Applies many dependency changes in one request. Not transactional itself: each item goes through
 * {@link TaskDependencyService} and commits or fails on its own, so one bad item never undoes the
 * others.
 */
@Service
public class BulkDependencyService {

  private static final Logger log = LoggerFactory.getLogger(BulkDependencyService.class);

  private final TaskDependencyService dependencyService;

  public BulkDependencyService(TaskDependencyService dependencyService) {
    this.dependencyService = dependencyService;
  }

  public enum Operation {
    CREATE,
    DELETE
  }

  /**
   * One requested change. CREATE reads the task ids and type (BLOCKS when absent); DELETE reads
   * {@code dependencyId}.
   */
  public record Item(
      UUID dependencyId, UUID dependentTaskId, UUID blockingTaskId, DependencyType type) {}

  public record Failure(int index, Item item, String title, String detail) {}

  /**
   * @param created edges stored by a CREATE; empty for DELETE
   * @param deleted dependency ids removed by a DELETE; empty for CREATE
   * @param cycles paths of the edges refused because they would close a cycle
   */
  public record Result(
      Operation operation,
      List<DependencyResponse> created,
      List<UUID> deleted,
      List<Failure> failed,
      List<List<UUID>> cycles) {}

  public Result apply(Operation operation, List<Item> items) {
    var created = new ArrayList<DependencyResponse>();
    var deleted = new ArrayList<UUID>();
    var failed = new ArrayList<Failure>();
    var cycles = new ArrayList<List<UUID>>();

    for (int i = 0; i < items.size(); i++) {
      var item = items.get(i);
      var missing = missingField(operation, item);
      if (missing != null) {
        failed.add(new Failure(i, item, "Invalid item", missing + " is required"));
        continue;
      }
      try {
        switch (operation) {
          case CREATE ->
              created.add(
                  dependencyService.createDependency(
                      item.dependentTaskId(),
                      item.blockingTaskId(),
                      item.type() != null ? item.type() : DependencyType.BLOCKS));
          case DELETE -> {
            dependencyService.deleteDependency(item.dependencyId());
            deleted.add(item.dependencyId());
          }
        }
      } catch (CircularDependencyException e) {
        cycles.add(e.getPath());
        failed.add(failure(i, item, e));
      } catch (ErrorResponseException e) {
        failed.add(failure(i, item, e));
      } catch (ConcurrencyFailureException | DataIntegrityViolationException e) {
        log.warn("Bulk {} item {} conflicted with a concurrent change", operation, i, e);
        failed.add(
            new Failure(
                i, item, "Concurrent modification", "Item conflicted with a concurrent change"));
      }
    }

    log.info(
        "Bulk {} of {} dependencies: {} succeeded, {} failed",
        operation,
        items.size(),
        created.size() + deleted.size(),
        failed.size());
    return new Result(operation, created, deleted, failed, cycles);
  }

  private static String missingField(Operation operation, Item item) {
    if (operation == Operation.DELETE) {
      return item.dependencyId() == null ? "dependencyId" : null;
    }
    if (item.dependentTaskId() == null) {
      return "dependentTaskId";
    }
    return item.blockingTaskId() == null ? "blockingTaskId" : null;
  }

  private static Failure failure(int index, Item item, ErrorResponseException e) {
    return new Failure(index, item, e.getBody().getTitle(), e.getBody().getDetail());
  }
}
