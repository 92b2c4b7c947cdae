package com.overseer.scope;

import com.overseer.models.CompletionMatch;
import com.overseer.models.ItemStatus;
import com.overseer.models.MatchType;
import com.overseer.models.TaskItem;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TaskScopeTest {

    @Test
    void startAssignsSequentialIds() {
        TaskScope scope = new TaskScope();
        scope.start("Auth", Arrays.asList("Login", " ", null, "Logout "));

        List<TaskItem> items = scope.getItems();
        assertEquals("Auth", scope.getTaskName());
        assertEquals(2, items.size());
        assertEquals("item-1", items.get(0).getId());
        assertEquals("item-2", items.get(1).getId());
        assertEquals("Logout", items.get(1).getName());
        assertEquals(ItemStatus.PENDING, items.get(0).getStatus());
    }

    @Test
    void startReplacesPreviousTask() {
        TaskScope scope = new TaskScope();
        scope.start("First", List.of("A", "B", "C"));
        scope.start("Second", List.of("X"));

        assertEquals(1, scope.getItems().size());
        assertEquals("item-1", scope.getItems().get(0).getId());
    }

    @Test
    void onlyOneItemInProgress() {
        TaskScope scope = new TaskScope();
        scope.start("Auth", List.of("Login", "Logout"));

        assertTrue(scope.setCurrentItem("item-1"));
        assertTrue(scope.setCurrentItem("item-2"));

        List<TaskItem> items = scope.getItems();
        assertEquals(ItemStatus.PENDING, items.get(0).getStatus());
        assertEquals(ItemStatus.IN_PROGRESS, items.get(1).getStatus());
        assertEquals("Logout", scope.getProgress().getCurrentItem());
        assertFalse(scope.setCurrentItem("item-9"));
    }

    @Test
    void statusNeverMovesBackward() {
        TaskScope scope = new TaskScope();
        scope.start("Auth", List.of("Login"));

        assertTrue(scope.updateItemStatus("item-1", ItemStatus.COMPLETED));
        assertFalse(scope.updateItemStatus("item-1", ItemStatus.PENDING));
        assertFalse(scope.updateItemStatus("item-1", ItemStatus.IN_PROGRESS));

        assertTrue(scope.setCurrentItem("item-1"));
        assertEquals(ItemStatus.COMPLETED, scope.getItems().get(0).getStatus());
    }

    @Test
    void progressRoundsPercentage() {
        TaskScope scope = new TaskScope();
        scope.start("Three", List.of("A", "B", "C"));
        scope.updateItemStatus("item-1", ItemStatus.COMPLETED);

        TaskScope.Progress progress = scope.getProgress();
        assertEquals(1, progress.getCompleted());
        assertEquals(3, progress.getTotal());
        assertEquals(33, progress.getPercentage());

        scope.updateItemStatus("item-2", ItemStatus.COMPLETED);
        assertEquals(67, scope.getProgress().getPercentage());
    }

    @Test
    void emptyScopeIsCompleteWithZeroProgress() {
        TaskScope scope = new TaskScope();

        assertTrue(scope.isComplete());
        assertEquals(0, scope.getProgress().getPercentage());
        assertTrue(scope.getPendingItems().isEmpty());
    }

    @Test
    void applyCompletionByIdOrName() {
        TaskScope scope = new TaskScope();
        scope.start("Auth", List.of("Login", "Logout"));

        assertTrue(scope.applyCompletion(new CompletionMatch("item-1", "Login", "done", 0.9, MatchType.CHECKBOX)));
        assertTrue(scope.applyCompletion(new CompletionMatch(null, "logout", "done", 0.9, MatchType.CHECKBOX)));
        assertFalse(scope.applyCompletion(new CompletionMatch("item-1", "Login", "again", 0.9, MatchType.CHECKBOX)));
        assertFalse(scope.applyCompletion(new CompletionMatch("item-7", "Unknown", "x", 0.9, MatchType.CODE)));

        assertTrue(scope.isComplete());
    }

    @Test
    void returnedItemsAreCopies() {
        TaskScope scope = new TaskScope();
        scope.start("Auth", List.of("Login"));

        scope.getItems().get(0).setStatus(ItemStatus.COMPLETED);

        assertFalse(scope.isComplete());
    }

    @Test
    void addAndRemoveItems() {
        TaskScope scope = new TaskScope();
        scope.start("Auth", List.of("Login"));

        TaskItem added = scope.addItem("Logout");
        assertEquals("item-2", added.getId());
        assertThrows(IllegalArgumentException.class, () -> scope.addItem(" "));

        assertTrue(scope.removeItem("item-1"));
        assertFalse(scope.removeItem("item-1"));
        assertEquals(1, scope.getItems().size());

        scope.clear();
        assertNull(scope.getTaskName());
        assertTrue(scope.getItems().isEmpty());
    }
}
