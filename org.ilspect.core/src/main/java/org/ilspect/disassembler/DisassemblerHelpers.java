/*
 * Copyright (c) 2002 - 2024 IBM Corporation.
 * All rights reserved. This program and the accompanying materials
 * are made available under the terms of the Eclipse Public License v1.0
 * which accompanies this distribution, and is available at
 * http://www.eclipse.org/legal/epl-v10.html
 *
 * Contributors:
 *     IBM Corporation - initial API and implementation
 */
package org.ilspect.disassembler;

import org.ilspect.core.cil.ExceptionHandler;
import org.ilspect.core.cil.ExceptionHandlerType;
import org.ilspect.core.cil.Instruction;
import org.ilspect.core.cil.LocalVariable;
import org.ilspect.core.metadata.FieldReference;
import org.ilspect.core.metadata.MethodReference;
import org.ilspect.core.metadata.ParameterDefinition;
import org.ilspect.core.metadata.TypeReference;
import org.ilspect.core.output.DecompilerOutput;

/** Textual forms of offsets, operands, instructions and handler table entries. */
public final class DisassemblerHelpers {

  private DisassemblerHelpers() {}

  public static String offsetToString(int offset) {
    return String.format("IL_%04X", offset);
  }

  /** Writes the label of {@code inst}, or {@code null} for a missing branch target. */
  public static void writeOffsetReference(DecompilerOutput output, Instruction inst) {
    output.write(inst == null ? "null" : offsetToString(inst.getOffset()));
  }

  /**
   * Writes {@code inst} as {@code IL_xxxx: opcode operand}.
   *
   * @return the output position at which the instruction text starts
   */
  public static int writeTo(Instruction inst, DecompilerOutput output) {
    int start = output.getNextPosition();
    output.write(offsetToString(inst.getOffset()));
    output.write(": ");
    output.write(inst.getOpCode().getName());
    if (inst.getOperand() != null) {
      output.write(" ");
      writeOperand(output, inst.getOperand());
    }
    return start;
  }

  public static void writeOperand(DecompilerOutput output, Object operand) {
    if (operand == null) {
      throw new IllegalArgumentException("operand is null");
    }
    if (operand instanceof Instruction) {
      writeOffsetReference(output, (Instruction) operand);
    } else if (operand instanceof Instruction[]) {
      Instruction[] targets = (Instruction[]) operand;
      output.write("(");
      for (int i = 0; i < targets.length; i++) {
        if (i > 0) {
          output.write(", ");
        }
        writeOffsetReference(output, targets[i]);
      }
      output.write(")");
    } else if (operand instanceof LocalVariable) {
      LocalVariable local = (LocalVariable) operand;
      output.write(
          local.getName() != null ? escape(local.getName()) : String.valueOf(local.getIndex()));
    } else if (operand instanceof ParameterDefinition) {
      output.write(escape(((ParameterDefinition) operand).getName()));
    } else if (operand instanceof MethodReference) {
      writeMethod(output, (MethodReference) operand);
    } else if (operand instanceof FieldReference) {
      FieldReference field = (FieldReference) operand;
      output.write(field.getFieldType() + " " + field.getDeclaringType().getFullName() + "::");
      output.write(escape(field.getName()));
    } else if (operand instanceof TypeReference) {
      output.write(((TypeReference) operand).getFullName());
    } else if (operand instanceof String) {
      output.write(quoteString((String) operand));
    } else if (operand instanceof Character) {
      output.write(Integer.toString((Character) operand));
    } else if (operand instanceof Float) {
      output.write(formatFloat((Float) operand));
    } else if (operand instanceof Double) {
      output.write(formatDouble((Double) operand));
    } else if (operand instanceof Boolean) {
      output.write((Boolean) operand ? "true" : "false");
    } else {
      output.write(operand.toString());
    }
  }

  private static void writeMethod(DecompilerOutput output, MethodReference method) {
    StringBuilder sb = new StringBuilder();
    if (method.hasThis()) {
      sb.append("instance ");
    }
    sb.append(method.getReturnType() == null ? "void" : method.getReturnType().getFullName());
    sb.append(' ').append(method.getDeclaringType().getFullName()).append("::");
    sb.append(escape(method.getName()));
    if (method.isGenericInstance()) {
      sb.append('<');
      for (int i = 0; i < method.getGenericArguments().size(); i++) {
        if (i > 0) sb.append(", ");
        sb.append(method.getGenericArguments().get(i).getFullName());
      }
      sb.append('>');
    }
    sb.append('(');
    for (int i = 0; i < method.getParameters().size(); i++) {
      if (i > 0) sb.append(", ");
      sb.append(method.getParameters().get(i).getType().getFullName());
    }
    sb.append(')');
    output.write(sb.toString());
  }

  private static String formatFloat(float f) {
    if (Float.isNaN(f)) return "(00 00 C0 FF)";
    if (Float.isInfinite(f)) return f > 0 ? "(00 00 80 7F)" : "(00 00 80 FF)";
    return Float.toString(f);
  }

  private static String formatDouble(double d) {
    if (Double.isNaN(d)) return "(00 00 00 00 00 00 F8 FF)";
    if (Double.isInfinite(d)) {
      return d > 0 ? "(00 00 00 00 00 00 F0 7F)" : "(00 00 00 00 00 00 F0 FF)";
    }
    return Double.toString(d);
  }

  /** Quotes identifiers that are not plain IL names. */
  public static String escape(String identifier) {
    if (identifier == null || identifier.isEmpty()) {
      return "''";
    }
    for (int i = 0; i < identifier.length(); i++) {
      char c = identifier.charAt(i);
      boolean ok =
          Character.isLetterOrDigit(c) || c == '_' || c == '.' || c == '$' || c == '`' || c == '@';
      if (!ok || (i == 0 && Character.isDigit(c))) {
        return "'" + identifier.replace("\\", "\\\\").replace("'", "\\'") + "'";
      }
    }
    return identifier;
  }

  public static String quoteString(String s) {
    StringBuilder sb = new StringBuilder(s.length() + 2).append('"');
    for (int i = 0; i < s.length(); i++) {
      char c = s.charAt(i);
      switch (c) {
        case '"':
          sb.append("\\\"");
          break;
        case '\\':
          sb.append("\\\\");
          break;
        case '\n':
          sb.append("\\n");
          break;
        case '\r':
          sb.append("\\r");
          break;
        case '\t':
          sb.append("\\t");
          break;
        case '\0':
          sb.append("\\0");
          break;
        default:
          if (Character.isISOControl(c)) {
            sb.append(String.format("\\u%04x", (int) c));
          } else {
            sb.append(c);
          }
      }
    }
    return sb.append('"').toString();
  }

  /** Writes one handler table entry, e.g. {@code .try IL_0000-IL_0010 catch T handler ...}. */
  public static void writeTo(ExceptionHandler eh, DecompilerOutput output, int codeSize) {
    output.write(".try ");
    output.write(rangeToString(eh.getTryStart(), eh.getTryEnd(), codeSize));
    output.write(" ");
    ExceptionHandlerType type = eh.getHandlerType();
    switch (type) {
      case CATCH:
        output.write("catch");
        if (eh.getCatchType() != null) {
          output.write(" " + eh.getCatchType().getFullName());
        }
        break;
      case FILTER:
        output.write("filter");
        if (eh.getFilterStart() != null) {
          output.write(" ");
          writeOffsetReference(output, eh.getFilterStart());
        }
        break;
      case FINALLY:
        output.write("finally");
        break;
      case FAULT:
        output.write("fault");
        break;
      default:
        output.write(type.toString().toLowerCase());
    }
    output.write(" handler ");
    output.write(rangeToString(eh.getHandlerStart(), eh.getHandlerEnd(), codeSize));
  }

  private static String rangeToString(Instruction start, Instruction end, int codeSize) {
    return offsetToString(start == null ? 0 : start.getOffset())
        + "-"
        + offsetToString(end == null ? codeSize : end.getOffset());
  }
}
