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


public class EmptyHeapException extends SortingException
{
   private static final long serialVersionUID = 2298436310954740281L;


   public EmptyHeapException(String operation)
   {
      super("Cannot " + operation + ": the heap is empty", Error.ERR_EMPTY_HEAP);
   }
}
