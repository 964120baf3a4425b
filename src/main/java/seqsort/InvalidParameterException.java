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


// Malformed configuration: bad gap, pivot out of range, wrong option type...
public class InvalidParameterException extends SortingException
{
   private static final long serialVersionUID = 5171309871934458623L;


   public InvalidParameterException(String message)
   {
      super(message, Error.ERR_INVALID_PARAM);
   }


   public InvalidParameterException(String message, Throwable cause)
   {
      super(message, cause, Error.ERR_INVALID_PARAM);
   }
}
