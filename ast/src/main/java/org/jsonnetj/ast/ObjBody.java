// SPDX-FileCopyrightText: © 2025 Greg Christiana <maxuser@pyjinn.org>
// SPDX-License-Identifier: MIT

package org.jsonnetj.ast;

import java.util.HashSet;
import java.util.List;

/** Contents of an object literal: either a static member list or a comprehension. */
public sealed interface ObjBody {
  <R> R accept(Visitor<R> visitor);

  interface Visitor<R> {
    R visitMemberList(MemberList memberList);

    R visitObjComp(ObjComp objComp);
  }

  record MemberList(List<Member> members) implements ObjBody {
    /**
     * @throws AstException with kind {@code DUPLICATE_STATIC_FIELD_NAME} if two fields have the
     *     same fixed name
     */
    public MemberList {
      members = List.copyOf(members);
      var names = new HashSet<String>();
      for (var field : fields(members)) {
        if (field.fieldName() instanceof FieldName.Fixed fixed && !names.add(fixed.value())) {
          throw new AstException(
              AstException.Kind.DUPLICATE_STATIC_FIELD_NAME,
              field.offset(),
              "Duplicate field name: \"%s\"".formatted(fixed.value()));
        }
      }
    }

    public List<Member.Field> fields() {
      return fields(members);
    }

    public List<Member.BindStmt> binds() {
      return members.stream()
          .filter(Member.BindStmt.class::isInstance)
          .map(Member.BindStmt.class::cast)
          .toList();
    }

    public List<Member.AssertStmt> asserts() {
      return members.stream()
          .filter(Member.AssertStmt.class::isInstance)
          .map(Member.AssertStmt.class::cast)
          .toList();
    }

    /** Fixed field names in declaration order. Computed names are known only when evaluated. */
    public List<String> fieldNames() {
      return fields().stream()
          .filter(f -> f.fieldName() instanceof FieldName.Fixed)
          .map(f -> ((FieldName.Fixed) f.fieldName()).value())
          .toList();
    }

    /** Fixed names of the fields that enumeration and serialization include, in order. */
    public List<String> visibleFieldNames() {
      return fields().stream()
          .filter(f -> f.fieldName() instanceof FieldName.Fixed && f.visibility().isVisible())
          .map(f -> ((FieldName.Fixed) f.fieldName()).value())
          .toList();
    }

    private static List<Member.Field> fields(List<Member> members) {
      return members.stream()
          .filter(Member.Field.class::isInstance)
          .map(Member.Field.class::cast)
          .toList();
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitMemberList(this);
    }
  }

  /**
   * {@code {local ..., [key]: value, local ... for x in xs ...}}: one field per binding tuple that
   * survives the generator chain {@code first} followed by {@code rest}.
   */
  record ObjComp(
      List<Member.BindStmt> preLocals,
      Expr key,
      Expr value,
      List<Member.BindStmt> postLocals,
      Expr.ForSpec first,
      List<Expr.CompSpec> rest)
      implements ObjBody {
    public ObjComp {
      preLocals = List.copyOf(preLocals);
      postLocals = List.copyOf(postLocals);
      rest = List.copyOf(rest);
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitObjComp(this);
    }
  }
}
