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


public final class Error
{
   public static final int ERR_MISSING_PARAM  = 1;
   public static final int ERR_INVALID_PARAM  = 2;
   public static final int ERR_UNKNOWN_METHOD = 3;
   public static final int ERR_EMPTY_HEAP     = 4;
   public static final int ERR_INVALID_MODE   = 5;
   public static final int ERR_TYPE_MISMATCH  = 6;
   public static final int ERR_UNKNOWN        = 127;


   private Error()
   {
   }
}
