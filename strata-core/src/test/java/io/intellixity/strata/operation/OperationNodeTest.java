package io.intellixity.strata.operation;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class OperationNodeTest {
  @Test
  void kindGuardMatchesOnlyItsOwnKind() {
    OperationNode table = TableNode.create("person");
    assertTrue(NodeKind.TABLE.is(table));
    assertFalse(NodeKind.COLUMN.is(table));
    assertFalse(NodeKind.TABLE.is(null));
  }

  @Test
  void childListsAreCopiedOnConstruction() {
    List<OperationNode> froms = new ArrayList<>();
    froms.add(TableNode.create("a"));
    FromNode from = FromNode.create(froms);
    froms.add(TableNode.create("b"));

    assertEquals(1, from.froms().size());
    assertThrows(UnsupportedOperationException.class, () -> from.froms().add(TableNode.create("c")));
  }

  @Test
  void nodesCompareStructurally() {
    assertEquals(ReferenceNode.create("t", "id"), ReferenceNode.create("t", "id"));
    assertNotEquals(ReferenceNode.create("t", "id"), ReferenceNode.create("u", "id"));
  }

  @Test
  void rawNodeNeedsOneMoreFragmentThanParameters() {
    assertThrows(IllegalArgumentException.class,
        () -> RawNode.create(List.of("a = ", ""), List.of(ValueNode.create(1), ValueNode.create(2))));
    RawNode ok = RawNode.create(List.of("a = ", " and b = ", ""), List.of(ValueNode.create(1), ValueNode.create(2)));
    assertEquals(2, ok.parameters().size());
  }

  @Test
  void valueListAcceptsNullValues() {
    ValueListNode list = ValueListNode.createFromValues(Arrays.asList(1, null, "x"));
    assertEquals(3, list.values().size());
    assertNull(((ValueNode) list.values().get(1)).value());
  }

  @Test
  void referenceColumnMustBeColumnOrSelectAll() {
    assertThrows(IllegalArgumentException.class,
        () -> new ReferenceNode(TableNode.create("t"), ValueNode.create(1)));
    assertEquals(NodeKind.SELECT_ALL, ReferenceNode.createSelectAll("t").column().kind());
  }

  @Test
  void joinRequiresOnUnlessCross() {
    TableNode pet = TableNode.create("pet");
    assertThrows(IllegalArgumentException.class, () -> JoinNode.create(JoinNode.JoinType.INNER, pet, null));
    assertThrows(IllegalArgumentException.class,
        () -> new JoinNode(JoinNode.JoinType.CROSS, pet, OnNode.create(ValueNode.createImmediate(true))));
    assertNull(JoinNode.createCross(pet).on());
  }

  @Test
  void selectRejectsDistinctTogetherWithDistinctOn() {
    SelectQueryNode q = SelectQueryNode.createFrom(TableNode.create("person")).withDistinct();
    assertTrue(q.distinct());
    assertThrows(IllegalArgumentException.class, () -> new SelectQueryNode(
        q.from(), List.of(), List.of(), true, List.of(ReferenceNode.create("id")),
        null, null, null, null, null, null));
  }

  @Test
  void whereClausesAreCombinedWithAnd() {
    SelectQueryNode q = SelectQueryNode.createFrom(TableNode.create("person"))
        .withWhere(BinaryOperationNode.create(ReferenceNode.create("a"), Operator.EQ, ValueNode.create(1)))
        .withWhere(BinaryOperationNode.create(ReferenceNode.create("b"), Operator.EQ, ValueNode.create(2)));
    assertEquals(NodeKind.AND, q.where().where().kind());
  }

  @Test
  void limitRejectsNegativeValues() {
    assertThrows(IllegalArgumentException.class, () -> LimitNode.create(-1));
    assertThrows(IllegalArgumentException.class, () -> OffsetNode.create(-5));
  }

  @Test
  void insertValidatesValuesShape() {
    TableNode person = TableNode.create("person");
    assertThrows(IllegalArgumentException.class,
        () -> InsertQueryNode.create(person, ColumnNode.createAll(List.of("a")), ValueNode.create(1)));
    ValuesNode twoWide = ValuesNode.create(List.of(ValueListNode.createFromValues(List.of(1, 2))));
    assertThrows(IllegalArgumentException.class,
        () -> InsertQueryNode.create(person, ColumnNode.createAll(List.of("a")), twoWide));
    assertNull(InsertQueryNode.createDefaultValues(person).values());
  }

  @Test
  void valuesRowsMustHaveEqualWidth() {
    assertThrows(IllegalArgumentException.class, () -> ValuesNode.create(List.of(
        ValueListNode.createFromValues(List.of(1, 2)),
        ValueListNode.createFromValues(List.of(3)))));
  }

  @Test
  void onConflictUpdateNeedsTarget() {
    ColumnUpdateNode set = ColumnUpdateNode.create("n", ValueNode.create(1));
    assertThrows(IllegalArgumentException.class, () -> new OnConflictNode(List.of(), null, List.of(set), null));
    assertTrue(OnConflictNode.createDoNothing(List.of("id")).doNothing());
    assertFalse(OnConflictNode.createDoUpdate(List.of("id"), List.of(set)).doNothing());
  }

  @Test
  void dropConstraintHoldsOnlyItsName() {
    DropConstraintNode node = DropConstraintNode.create("person_pk");
    assertEquals(IdentifierNode.create("person_pk"), node.constraintName());
    assertThrows(NullPointerException.class, () -> new DropConstraintNode(null));
  }

  @Test
  void foreignKeyColumnCountsMustMatch() {
    assertThrows(IllegalArgumentException.class, () -> ForeignKeyConstraintNode.create(
        List.of("a", "b"), TableNode.create("other"), List.of("id")));
  }

  @Test
  void dataTypeAndFunctionNamesAreValidated() {
    assertEquals("varchar(255)", DataTypeNode.create("varchar(255)").dataType());
    assertThrows(IllegalArgumentException.class, () -> DataTypeNode.create("int; drop table x"));
    assertThrows(IllegalArgumentException.class, () -> FunctionNode.create("count(*) --"));
  }

  @Test
  void emptyIdentifierIsRejected() {
    assertThrows(IllegalArgumentException.class, () -> IdentifierNode.create(""));
    assertThrows(NullPointerException.class, () -> IdentifierNode.create(null));
  }
}
