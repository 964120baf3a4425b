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
import seqsort.UnknownMethodException;


public enum SortMethod
{
   BUBBLE("bubble", true),
   SHORT_BUBBLE("short_bubble", true),
   SELECTION("selection", false),
   INSERTION("insertion", true),
   SHELL("shell", false),
   QUICK("quick", false),
   MERGE("merge", true),
   HEAP("heap", false);

   private final String name;
   private final boolean stable;


   SortMethod(String name, boolean stable)
   {
      this.name = name;
      this.stable = stable;
   }


   public String getName()
   {
      return this.name;
   }


   public boolean isStable()
   {
      return this.stable;
   }


   // Case insensitive, '-' and '_' separators are optional (EG. shortBubble,
   // short-bubble, SHORT_BUBBLE)
   public static SortMethod fromName(String name)
   {
      if (name == null)
         throw new UnknownMethodException(null);

      final String key = name.trim().toUpperCase(Locale.ROOT).replace("-", "").replace("_", "");

      switch (key)
      {
         case "BUBBLE":
            return BUBBLE;

         case "SHORTBUBBLE":
            return SHORT_BUBBLE;

         case "SELECTION":
            return SELECTION;

         case "INSERTION":
            return INSERTION;

         case "SHELL":
            return SHELL;

         case "QUICK":
            return QUICK;

         case "MERGE":
            return MERGE;

         case "HEAP":
            return HEAP;

         default:
            throw new UnknownMethodException(name);
      }
   }
}
