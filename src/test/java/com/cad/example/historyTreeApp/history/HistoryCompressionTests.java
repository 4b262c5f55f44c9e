package com.cad.example.historyTreeApp.history;

import com.cad.example.historyTreeApp.history.exception.DuplicateOperationException;
import com.cad.example.historyTreeApp.history.model.EntityId;
import com.cad.example.historyTreeApp.history.model.Point2;
import com.cad.example.historyTreeApp.history.model.VariableId;
import com.cad.example.historyTreeApp.history.model.Vector2;
import com.cad.example.historyTreeApp.history.operation.Operation;
import com.cad.example.historyTreeApp.history.operation.OperationFactory;
import com.cad.example.historyTreeApp.history.operation.OperationId;
import com.cad.example.historyTreeApp.history.operation.OperationType;
import com.cad.example.historyTreeApp.history.operation.SequentialOperationIdGenerator;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

@Slf4j
public class HistoryCompressionTests {
  private static final List<EntityId> ENTITIES = List.of(EntityId.of(10), EntityId.of(11));

  private OperationFactory factory;
  private HistoryTree tree;

  @BeforeEach
  void setUp() {
    factory = new OperationFactory(new SequentialOperationIdGenerator());
    tree = new HistoryTree(HistoryTreeConfig.builder().operationFactory(factory).build());
  }

  @Test
  void mergeMovesTest() {
    Operation create = createPoint("Create");
    Operation firstMove = move(3, 0, "Move right");
    Operation secondMove = move(0, 4, "Move up");
    Operation last = createPoint("Create another");
    tree.addOperation(create);
    tree.addOperation(firstMove);
    tree.addOperation(secondMove);
    tree.addOperation(last);

    int removed = tree.compressHistory();

    Assertions.assertEquals(1, removed);
    Assertions.assertEquals(3, tree.size());
    Assertions.assertTrue(tree.findOperation(firstMove.getId()).isEmpty());
    Assertions.assertTrue(tree.findOperation(secondMove.getId()).isEmpty());

    List<Operation> current = tree.currentOperations();
    Assertions.assertEquals(3, current.size());
    Operation merged = current.get(1);
    OperationType.MoveEntities type = (OperationType.MoveEntities) merged.getType();
    Assertions.assertEquals(new Vector2(3, 4), type.getOffset());
    Assertions.assertEquals(ENTITIES, type.getEntityIds());
    Assertions.assertEquals("Move up", merged.getDescription());
    Assertions.assertTrue(merged.getId().compareTo(last.getId()) > 0);

    HistoryNode lastNode = tree.getNode(last.getId()).orElseThrow();
    Assertions.assertEquals(merged.getId(), lastNode.getParent());
    Assertions.assertEquals(2, lastNode.getDepth());
    Assertions.assertEquals(1, tree.getStats().getCompressionSavings());
    Assertions.assertEquals(4, tree.getStats().getTotalOperations());
    Assertions.assertTrue(tree.isConsistent());
  }

  @Test
  void mergeMovesKeepsFirstPreviousPositionsTest() {
    List<Point2> before = List.of(new Point2(0, 0), new Point2(1, 1));
    tree.addOperation(factory.moveEntities(ENTITIES, new Vector2(1, 0), before, "First"));
    tree.addOperation(factory.moveEntities(List.of(EntityId.of(11), EntityId.of(10)), new Vector2(1, 0),
      List.of(new Point2(1, 0), new Point2(2, 1)), "Second"));
    tree.addOperation(createPoint("Create"));

    Assertions.assertEquals(1, tree.compressHistory());

    Operation root = tree.findOperation(tree.getRootId().orElseThrow()).orElseThrow();
    OperationType.MoveEntities type = (OperationType.MoveEntities) root.getType();
    Assertions.assertEquals(new Vector2(2, 0), type.getOffset());
    Assertions.assertEquals(before, type.getPreviousPositions());
    Assertions.assertNull(tree.getNode(root.getId()).orElseThrow().getParent());
  }

  @Test
  void mergeVariableModificationsTest() {
    VariableId width = new VariableId(7);
    tree.addOperation(factory.modifyVariable(width, 1.0, 2.0, "width 2"));
    tree.addOperation(factory.modifyVariable(width, 2.0, 5.0, "width 5"));
    tree.addOperation(createPoint("Create"));

    Assertions.assertEquals(1, tree.compressHistory());

    Operation merged = tree.currentOperations().get(0);
    OperationType.ModifyVariable type = (OperationType.ModifyVariable) merged.getType();
    Assertions.assertEquals(width, type.getVariableId());
    Assertions.assertEquals(1.0, type.getPreviousValue());
    Assertions.assertEquals(5.0, type.getNewValue());
    Assertions.assertEquals("Merged variable modifications: width 2 -> width 5", merged.getDescription());
  }

  @Test
  void differentVariablesNotMergedTest() {
    tree.addOperation(factory.modifyVariable(new VariableId(1), 1.0, 2.0, "a"));
    tree.addOperation(factory.modifyVariable(new VariableId(2), 1.0, 2.0, "b"));
    tree.addOperation(createPoint("Create"));

    Assertions.assertEquals(0, tree.compressHistory());
    Assertions.assertEquals(3, tree.size());
  }

  @Test
  void nonMergeableAdjacencyTest() {
    Operation create = createPoint("Create");
    Operation delete = factory.deleteEntity(EntityId.of(1), JsonNodeFactory.instance.objectNode(), "Delete");
    tree.addOperation(create);
    tree.addOperation(delete);
    tree.addOperation(move(1, 1, "Move"));
    tree.addOperation(factory.modifyVariable(new VariableId(1), 0.0, 1.0, "Variable"));
    tree.addOperation(createPoint("Create again"));

    Assertions.assertEquals(0, tree.compressHistory());
    Assertions.assertEquals(5, tree.size());
    Assertions.assertTrue(tree.findOperation(create.getId()).isPresent());
    Assertions.assertTrue(tree.findOperation(delete.getId()).isPresent());
    Assertions.assertEquals(0, tree.getStats().getCompressionSavings());
  }

  @Test
  void currentNodeNotMergedTest() {
    Operation firstMove = move(1, 0, "Move 1");
    Operation secondMove = move(1, 0, "Move 2");
    tree.addOperation(firstMove);
    tree.addOperation(secondMove);

    Assertions.assertEquals(0, tree.compressHistory());

    // current is now the parent of the pair
    tree.undo();
    Assertions.assertEquals(0, tree.compressHistory());
    Assertions.assertEquals(secondMove, tree.redo().orElseThrow());
  }

  @Test
  void branchTargetNotMergedTest() {
    Operation firstMove = move(1, 0, "Move 1");
    Operation secondMove = move(1, 0, "Move 2");
    tree.addOperation(firstMove);
    tree.addOperation(secondMove);
    tree.addOperation(createPoint("Create"));
    tree.createBranch("checkpoint", secondMove.getId());

    Assertions.assertEquals(0, tree.compressHistory());
    Assertions.assertEquals(secondMove, tree.switchBranch("checkpoint"));
  }

  @Test
  void branchPointNotFoldedTest() {
    Operation firstMove = move(1, 0, "Move 1");
    tree.addOperation(firstMove);
    tree.addOperation(move(1, 0, "Move 2"));
    tree.undo();
    tree.addOperation(move(2, 0, "Move 3"));
    tree.addOperation(createPoint("Create"));

    Assertions.assertEquals(0, tree.compressHistory());
    Assertions.assertEquals(2, tree.getNode(firstMove.getId()).orElseThrow().getChildren().size());
  }

  @Test
  void chainFoldsIntoOneNodeTest() {
    tree.addOperation(move(1, 0, "Move 1"));
    tree.addOperation(move(2, 0, "Move 2"));
    tree.addOperation(move(3, 0, "Move 3"));
    Operation last = createPoint("Create");
    tree.addOperation(last);

    Assertions.assertEquals(2, tree.compressHistory());
    Assertions.assertEquals(2, tree.size());

    Operation merged = tree.currentOperations().get(0);
    Assertions.assertEquals(new Vector2(6, 0), ((OperationType.MoveEntities) merged.getType()).getOffset());
    Assertions.assertEquals("Move 3", merged.getDescription());
    Assertions.assertEquals(1, tree.getNode(last.getId()).orElseThrow().getDepth());
    Assertions.assertEquals(2, tree.getStats().getCompressionSavings());

    // nothing left to merge
    Assertions.assertEquals(0, tree.compressHistory());
    Assertions.assertEquals(2, tree.getStats().getCompressionSavings());
  }

  @Test
  void undoAndRedoAfterCompressionTest() {
    Operation create = createPoint("Create");
    Operation last = createPoint("Create again");
    tree.addOperation(create);
    tree.addOperation(move(1, 0, "Move 1"));
    tree.addOperation(move(0, 1, "Move 2"));
    tree.addOperation(last);
    tree.undo();
    tree.undo();
    tree.undo();

    Assertions.assertEquals(1, tree.compressHistory());

    Operation merged = tree.redo().orElseThrow();
    Assertions.assertEquals(new Vector2(1, 1), ((OperationType.MoveEntities) merged.getType()).getOffset());
    Assertions.assertEquals(last, tree.redo().orElseThrow());
    Assertions.assertTrue(tree.redo().isEmpty());
    Assertions.assertEquals(List.of(create.getId(), merged.getId(), last.getId()),
      List.of(tree.currentOperations().get(0).getId(), tree.currentOperations().get(1).getId(),
        tree.currentOperations().get(2).getId()));

    Assertions.assertEquals(last, tree.undo().orElseThrow());
    Assertions.assertEquals(merged, tree.undo().orElseThrow());
    Assertions.assertEquals(create.getId(), tree.getCurrentId().orElseThrow());
    Assertions.assertTrue(tree.isConsistent());
  }

  @Test
  void autoCompressAtCeilingTest() {
    tree = new HistoryTree(HistoryTreeConfig.builder()
      .maxOperations(3)
      .operationFactory(factory)
      .build());
    tree.addOperation(move(1, 0, "Move 1"));
    tree.addOperation(move(1, 0, "Move 2"));
    tree.addOperation(createPoint("Create"));
    Assertions.assertEquals(3, tree.size());

    Operation fourth = createPoint("Create again");
    tree.addOperation(fourth);

    Assertions.assertEquals(3, tree.size());
    Assertions.assertEquals(1, tree.getStats().getCompressionSavings());
    Assertions.assertEquals(4, tree.getStats().getTotalOperations());
    Assertions.assertEquals(fourth.getId(), tree.getCurrentId().orElseThrow());
    Assertions.assertEquals(2, tree.getStats().getCurrentDepth());
  }

  @Test
  void autoCompressDisabledTest() {
    tree = new HistoryTree(HistoryTreeConfig.builder()
      .maxOperations(2)
      .autoCompress(false)
      .operationFactory(factory)
      .build());
    tree.addOperation(move(1, 0, "Move 1"));
    tree.addOperation(move(1, 0, "Move 2"));
    tree.addOperation(createPoint("Create"));
    tree.addOperation(createPoint("Create again"));

    Assertions.assertEquals(4, tree.size());
    Assertions.assertEquals(0, tree.getStats().getCompressionSavings());
  }

  @Test
  void compressionKeepsOtherBranchesTest() {
    Operation create = createPoint("Create");
    tree.addOperation(create);
    tree.addOperation(move(1, 0, "Left 1"));
    tree.addOperation(move(1, 0, "Left 2"));
    tree.addOperation(createPoint("Left end"));
    tree.gotoOperation(create.getId());
    tree.addOperation(move(0, 1, "Right 1"));
    tree.addOperation(move(0, 1, "Right 2"));
    Operation rightEnd = createPoint("Right end");
    tree.addOperation(rightEnd);

    Assertions.assertEquals(2, tree.compressHistory());
    Assertions.assertEquals(5, tree.size());
    Assertions.assertEquals(2, tree.getNode(create.getId()).orElseThrow().getChildren().size());
    Assertions.assertEquals(3, tree.currentOperations().size());
    Assertions.assertEquals(rightEnd.getId(), tree.getCurrentId().orElseThrow());

    OperationId mergedRight = tree.getNode(rightEnd.getId()).orElseThrow().getParent();
    Operation right = tree.findOperation(mergedRight).orElseThrow();
    Assertions.assertEquals(new Vector2(0, 2), ((OperationType.MoveEntities) right.getType()).getOffset());
    log.debug("compressed tree:\n{}", tree.treeString());
    Assertions.assertTrue(tree.isConsistent());
  }

  @Test
  void mergedIdSkipsIdsFromAnotherGeneratorTest() {
    OperationFactory editorFactory = new OperationFactory(new SequentialOperationIdGenerator());
    Operation create = editorFactory.createEntity(JsonNodeFactory.instance.objectNode(), "Create");
    tree.addOperation(create);
    tree.addOperation(editorFactory.moveEntities(ENTITIES, new Vector2(1, 0), List.of(), "Move 1"));
    tree.addOperation(editorFactory.moveEntities(ENTITIES, new Vector2(2, 0), List.of(), "Move 2"));
    Operation last = editorFactory.createEntity(JsonNodeFactory.instance.objectNode(), "Create again");
    tree.addOperation(last);

    Assertions.assertEquals(1, tree.compressHistory());

    Assertions.assertEquals(3, tree.size());
    Assertions.assertEquals(create.getId(), tree.getRootId().orElseThrow());
    OperationId mergedId = tree.getNode(last.getId()).orElseThrow().getParent();
    Assertions.assertTrue(mergedId.compareTo(last.getId()) > 0);
    Operation merged = tree.findOperation(mergedId).orElseThrow();
    Assertions.assertEquals(new Vector2(3, 0), ((OperationType.MoveEntities) merged.getType()).getOffset());
    Assertions.assertTrue(tree.isConsistent());
  }

  @Test
  void mergedIdCollisionLeavesTreeUnchangedTest() {
    SequentialOperationIdGenerator generator = new SequentialOperationIdGenerator();
    factory = new OperationFactory(generator);
    tree = new HistoryTree(HistoryTreeConfig.builder().operationFactory(factory).build());
    tree.addOperation(createPoint("Create"));
    tree.addOperation(move(1, 0, "Move 1"));
    tree.addOperation(move(1, 0, "Move 2"));
    tree.addOperation(createPoint("Create again"));
    String before = tree.treeString();

    // next merged id is #1, the root
    generator.reset();

    Assertions.assertThrows(DuplicateOperationException.class, () -> tree.compressHistory());
    Assertions.assertEquals(4, tree.size());
    Assertions.assertEquals(before, tree.treeString());
    Assertions.assertEquals(0, tree.getStats().getCompressionSavings());
    Assertions.assertTrue(tree.isConsistent());
  }

  @Test
  void ceilingWithNothingMergeableKeepsGrowingTest() {
    tree = new HistoryTree(HistoryTreeConfig.builder()
      .maxOperations(2)
      .operationFactory(factory)
      .build());
    tree.addOperation(createPoint("Create 1"));
    tree.addOperation(createPoint("Create 2"));
    tree.addOperation(createPoint("Create 3"));
    tree.addOperation(createPoint("Create 4"));

    Assertions.assertEquals(4, tree.size());
    Assertions.assertEquals(0, tree.getStats().getCompressionSavings());
    Assertions.assertEquals(0, tree.compressHistory());
  }

  private Operation move(final double x, final double y, final String description) {
    return factory.moveEntities(ENTITIES, new Vector2(x, y), List.of(), description);
  }

  private Operation createPoint(final String description) {
    return factory.createEntity(JsonNodeFactory.instance.objectNode().put("kind", "point"), description);
  }
}
