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


public class UnknownMethodException extends SortingException
{
   private static final long serialVersionUID = -6911807214426094347L;

   private final String method;


   public UnknownMethodException(String method)
   {
      super("Unknown sort method: " + method, Error.ERR_UNKNOWN_METHOD);
      this.method = method;
   }


   public String getMethod()
   {
      return this.method;
   }
}
