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

package seqsort.util.sort;

import java.util.Locale;
import seqsort.InvalidParameterException;


// Rule used by QuickSort to select the pivot of each partition
public enum PivotStrategy
{
   FIRST,
   LAST,
   MIDDLE,
   MEDIAN_OF_THREE,
   POSITION; // relative position in the range, see QuickSort


   public static PivotStrategy fromName(String name)
   {
      if (name == null)
         throw new InvalidParameterException("Invalid null pivot strategy");

      switch (name.trim().toUpperCase(Locale.ROOT).replace('-', '_'))
      {
         case "FIRST":
            return FIRST;

         case "LAST":
            return LAST;

         case "MIDDLE":
            return MIDDLE;

         case "MEDIAN3":
         case "MEDIAN_OF_THREE":
            return MEDIAN_OF_THREE;

         default:
            throw new InvalidParameterException("Unknown pivot strategy: "+name);
      }
   }
}
