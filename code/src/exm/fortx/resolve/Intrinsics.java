/*
 * Copyright 2013 University of Chicago and Argonne National Laboratory
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License
 */
package exm.fortx.resolve;

import java.util.Arrays;
import java.util.HashSet;
import java.util.Set;

/**
 * Names of Fortran intrinsic procedures, which resolve without a
 * declaration
 */
public class Intrinsics {

  private static final Set<String> PROCEDURES = new HashSet<String>(
      Arrays.asList(
        "abs", "achar", "acos", "adjustl", "adjustr", "aimag", "aint",
        "all", "allocated", "anint", "any", "asin", "associated", "atan",
        "atan2", "bit_size", "btest", "ceiling", "char", "cmplx", "conjg",
        "cos", "cosh", "count", "cpu_time", "cshift", "date_and_time",
        "dble", "digits", "dim", "dot_product", "dprod", "eoshift",
        "epsilon", "execute_command_line", "exp", "exponent", "floor",
        "fraction", "get_command_argument", "huge", "iachar", "iand",
        "ibclr", "ibits", "ibset", "ichar", "ieor", "index", "int", "ior",
        "ishft", "ishftc", "kind", "lbound", "len", "len_trim", "log",
        "log10", "logical", "matmul", "max", "maxloc", "maxval", "merge",
        "min", "minloc", "minval", "mod", "modulo", "move_alloc", "nint",
        "not", "null", "pack", "present", "product", "random_number",
        "random_seed", "real", "repeat", "reshape", "scan", "selected_int_kind",
        "selected_real_kind", "shape", "sign", "sin", "sinh", "size",
        "spacing", "spread", "sqrt", "sum", "system_clock", "tan", "tanh",
        "tiny", "transfer", "transpose", "trim", "ubound", "unpack",
        "verify"));

  /** Intrinsics with side effects */
  private static final Set<String> IMPURE = new HashSet<String>(
      Arrays.asList("cpu_time", "date_and_time", "execute_command_line",
                    "get_command_argument", "random_number", "random_seed",
                    "system_clock"));

  public static boolean isIntrinsic(String name) {
    return PROCEDURES.contains(name.toLowerCase());
  }

  public static boolean isPure(String name) {
    String n = name.toLowerCase();
    return PROCEDURES.contains(n) && !IMPURE.contains(n);
  }
}
