/*
Copyright 2026 The seqsort Authors
Licensed under the Apache License, Version 2.0 (the "License");
you may not use this file except in compliance with the License.
you may obtain a copy of the License at

                http://www.apache.org/licenses/LICENSE-2.0

Unless required by applicable law or agreed to in writing, software
distributed under the License is distributed on an "AS IS" BASIS,
WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
See the License for the specific language governing permissions and
limitations under the License.
*/

package seqsort;


// Raised at the first comparison involving values that cannot be ordered
// against each other (null, not Comparable or of incompatible types).
public class TypeMismatchException extends SortingException
{
   private static final long serialVersionUID = 8836019725611260218L;


   public TypeMismatchException(Object a, Object b)
   {
      super(message(a, b), Error.ERR_TYPE_MISMATCH);
   }


   public TypeMismatchException(Object a, Object b, Throwable cause)
   {
      super(message(a, b), cause, Error.ERR_TYPE_MISMATCH);
   }


   private static String message(Object a, Object b)
   {
      return "Cannot compare " + describe(a) + " with " + describe(b);
   }


   private static String describe(Object o)
   {
      return (o == null) ? "null" : (o + " (" + o.getClass().getSimpleName() + ")");
   }
}
