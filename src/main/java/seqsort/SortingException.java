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


// Base class of all the errors raised by the sorters, searches and heaps.
// The error code is one of the constants in seqsort.Error
public class SortingException extends RuntimeException
{
   private static final long serialVersionUID = -3350431868264315520L;

   private final int code;


   public SortingException(String message, int code)
   {
      super(message);
      this.code = code;
   }


   public SortingException(String message, Throwable cause, int code)
   {
      super(message, cause);
      this.code = code;
   }


   public int getErrorCode()
   {
      return this.code;
   }
}
